package io.mersel.services.lawmd.web.dto;

import io.mersel.services.lawmd.application.models.SplitResult;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Bölme isteği yanıtı.
 *
 * @param savedCount      Yazılan dosya sayısı
 * @param failedFilenames Yazılamayan (çakışan veya hatalı) dosya adları
 * @param outputDirectory Dosyaların yazıldığı dizin
 */
@Schema(description = "Madde bazlı bölme sonucu")
public record SplitResponse(
        int savedCount,
        List<String> failedFilenames,
        String outputDirectory
) {

    public static SplitResponse from(SplitResult result) {
        return new SplitResponse(result.savedCount(), result.failedFilenames(),
                result.outputDirectory().toString());
    }
}
