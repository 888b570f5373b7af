package io.mersel.services.lawmd.application.models;

import java.nio.file.Path;
import java.util.List;

/**
 * Madde bazlı dosyalara bölme sonucu.
 * <p>
 * Dosya adı çakışması veya yazma hatası bölme işlemini durdurmaz;
 * ilgili dosya adı {@code failedFilenames} listesine eklenir.
 *
 * @param savedCount      Başarıyla yazılan dosya sayısı
 * @param failedFilenames Yazılamayan dosya adları (karşılaşma sırasında)
 * @param outputDirectory Çıktı dizini
 */
public record SplitResult(
        int savedCount,
        List<String> failedFilenames,
        Path outputDirectory
) {

    public SplitResult {
        failedFilenames = List.copyOf(failedFilenames);
    }

    public boolean hasFailures() {
        return !failedFilenames.isEmpty();
    }
}
