package io.mersel.services.lawmd.web.controllers;

import io.mersel.services.lawmd.application.interfaces.DocumentParseException;
import io.mersel.services.lawmd.application.interfaces.MissingArticlesException;
import io.mersel.services.lawmd.application.models.ConvertedDocument;
import io.mersel.services.lawmd.application.models.ConverterOptions;
import io.mersel.services.lawmd.application.models.SplitResult;
import io.mersel.services.lawmd.infrastructure.LawMarkdownConverter;
import io.mersel.services.lawmd.infrastructure.LawMarkdownConverterFactory;
import io.mersel.services.lawmd.web.dto.SplitRequestDto;
import io.mersel.services.lawmd.web.dto.SplitResponse;
import io.mersel.services.lawmd.web.infrastructure.DocumentUploads;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Madde bazlı bölme endpoint'i.
 * <p>
 * Belge dönüştürülür ve Markdown çıktısı madde başlıklarından bölünerek her madde
 * sunucudaki çıktı kökü altında ayrı bir {@code .md} dosyasına yazılır. Var olan
 * dosyaların üzerine yazılmaz; çakışmalar yanıttaki {@code failedFilenames}
 * listesinde raporlanır.
 * <p>
 * Her istek yeni bir dönüştürücü kullanır, dosya adı ek sayacı istekler arasında
 * paylaşılmaz.
 */
@RestController
@RequestMapping("/v1")
@Tag(name = "Split", description = "Madde bazlı dosyalara bölme")
public class SplitController {

    private static final Logger log = LoggerFactory.getLogger(SplitController.class);

    @Value("${lawmd.limits.max-document-size-mb:${LAWMD_MAX_DOCUMENT_SIZE_MB:50}}")
    private int maxDocumentSizeMb;

    @Value("${lawmd.split.output-root:${LAWMD_SPLIT_OUTPUT_ROOT:${java.io.tmpdir}/lawmd-split}}")
    private String outputRoot;

    private final LawMarkdownConverterFactory converterFactory;

    public SplitController(LawMarkdownConverterFactory converterFactory) {
        this.converterFactory = converterFactory;
    }

    @Operation(
            summary = "Madde Bazlı Bölme",
            description = """
                    Belgeyi dönüştürür ve her maddeyi ayrı bir Markdown dosyasına yazar.

                    **Dosya adı kalıbı:** `{prefix}`, `{num}`, `{code}` yer tutucuları; `.md` otomatik eklenir.
                    Ekli numaralar (`5bis`, `5ter`) `5-2bis`, `5-3ter` biçiminde adlandırılır.

                    **Hedef dizin:** sunucu çıktı köküne göreli olmalıdır; kök dışına çıkan yollar reddedilir.
                    """,
            responses = {
                    @ApiResponse(responseCode = "200", description = "Bölme tamamlandı (kısmi başarısızlıklar dahil)", content = @Content(mediaType = "application/json")),
                    @ApiResponse(responseCode = "400", description = "Geçersiz hedef dizin veya kalıp", content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "422", description = "XML ayrıştırılamadı veya madde içermiyor", content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping(value = "/split", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SplitResponse> split(@ModelAttribute @Valid SplitRequestDto requestDto)
            throws IOException, DocumentParseException, MissingArticlesException {

        byte[] xml = DocumentUploads.read(requestDto.getDocument(), maxDocumentSizeMb);
        String pattern = validatePattern(requestDto.getFilenamePattern());
        Path target = resolveTarget(requestDto.getTargetDirectory());

        ConverterOptions options = requestDto.applyTo(converterFactory.defaultOptions());
        if (requestDto.getInitialSuffixCounter() != null) {
            options = options.toBuilder().initialSuffixCounter(requestDto.getInitialSuffixCounter()).build();
        }
        LawMarkdownConverter converter = converterFactory.create(options);

        log.info("Bölme isteği, belge: {} byte, hedef: {}, kalıp: '{}'", xml.length, target, pattern);

        ConvertedDocument document = converter.convertDocument(xml);
        SplitResult result = converter.split(document.markdown(), target, pattern);

        return ResponseEntity.ok(SplitResponse.from(result));
    }

    /**
     * Hedef dizini çıktı köküne göre çözümler.
     *
     * @throws IllegalArgumentException Yol kökün dışına çıkıyorsa
     */
    Path resolveTarget(String targetDirectory) {
        Path root = Path.of(outputRoot).toAbsolutePath().normalize();
        Path target = root.resolve(targetDirectory.strip()).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IllegalArgumentException("Hedef dizin çıktı kökünün altında olmalı: " + targetDirectory);
        }
        return target;
    }

    private static String validatePattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return SplitRequestDto.DEFAULT_FILENAME_PATTERN;
        }
        if (!pattern.contains("{num}")) {
            throw new IllegalArgumentException("Dosya adı kalıbı {num} yer tutucusunu içermeli: " + pattern);
        }
        if (pattern.contains("/") || pattern.contains("\\") || pattern.contains("..")) {
            throw new IllegalArgumentException("Dosya adı kalıbı dizin ayırıcı içeremez: " + pattern);
        }
        return pattern;
    }
}
