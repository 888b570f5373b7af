package io.mersel.services.lawmd.application.models;

import java.util.List;

/**
 * Ayrıştırılmış tek bir madde.
 * <p>
 * Dönüşüm çağrısı başına bir kez oluşturulur, sonrasında değişmez.
 *
 * @param number       Madde numarası ("40b"); numarasız ek maddelerde boş
 * @param breadcrumb   Kökten maddeye doğru üst bölüm başlıkları
 * @param finalSection Son/geçiş hükümleri bölgesinde mi (çağrı içinde yapışkan)
 * @param lines        Belge sırasındaki içerik satırları
 * @param notes        Numara sırasındaki yazar notları
 */
public record Article(
        String number,
        List<String> breadcrumb,
        boolean finalSection,
        List<ContentLine> lines,
        List<AuthorialNote> notes
) {

    public Article {
        number = number == null ? "" : number;
        breadcrumb = List.copyOf(breadcrumb);
        lines = List.copyOf(lines);
        notes = List.copyOf(notes);
    }

    public boolean hasNumber() {
        return !number.isEmpty();
    }
}
