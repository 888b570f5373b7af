package io.mersel.services.lawmd.application.models;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Tam belge dönüşüm sonucu.
 * <p>
 * Birleştirilmiş Markdown metninin yanında yapılandırılmış madde listesini de
 * taşır; tek madde dışa aktarımı ve bölme işlemi Markdown'ı yeniden
 * ayrıştırmadan bu liste üzerinden yapılabilir.
 *
 * @param title       Belge başlığı (kanun kısaltması, ör. "CO")
 * @param generatedAt Üretim zamanı
 * @param articles    Belge sırasındaki maddeler
 * @param markdown    Birleştirilmiş Markdown metni
 */
public record ConvertedDocument(
        String title,
        LocalDateTime generatedAt,
        List<Article> articles,
        String markdown
) {

    public ConvertedDocument {
        articles = List.copyOf(articles);
    }

    /**
     * Numarası verilen değerle birebir eşleşen ilk maddeyi döner.
     */
    public Optional<Article> findArticle(String number) {
        if (number == null || number.isBlank()) {
            return Optional.empty();
        }
        String wanted = number.strip();
        return articles.stream()
                .filter(a -> a.number().equalsIgnoreCase(wanted))
                .findFirst();
    }

    /** Tüm maddelerdeki yazar notu sayısı. */
    public int noteCount() {
        return articles.stream().mapToInt(a -> a.notes().size()).sum();
    }
}
