package io.mersel.services.lawmd.web.controllers;

import io.mersel.services.lawmd.application.interfaces.ArticleNotFoundException;
import io.mersel.services.lawmd.application.interfaces.DocumentParseException;
import io.mersel.services.lawmd.application.interfaces.MissingArticlesException;
import io.mersel.services.lawmd.application.models.ConvertedDocument;
import io.mersel.services.lawmd.application.models.ConverterOptions;
import io.mersel.services.lawmd.infrastructure.LawMarkdownConverter;
import io.mersel.services.lawmd.infrastructure.LawMarkdownConverterFactory;
import io.mersel.services.lawmd.web.dto.ArticleRequestDto;
import io.mersel.services.lawmd.web.dto.ConvertRequestDto;
import io.mersel.services.lawmd.web.infrastructure.DocumentUploads;
import io.mersel.services.lawmd.web.infrastructure.LawmdHeaders;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Markdown dönüşüm endpoint'leri.
 * <p>
 * Başarılı dönüşümde {@code text/markdown} body ile birlikte metadata'yı
 * {@code X-Lawmd-*} response header'larında döner. Hata durumunda RFC 7807
 * {@code application/problem+json} formatında yanıt döner.
 *
 * <h3>Başarılı Yanıt Örneği</h3>
 * <pre>
 * HTTP/1.1 200 OK
 * Content-Type: text/markdown; charset=utf-8
 * X-Lawmd-Article-Count: 1275
 * X-Lawmd-Note-Count: 3110
 * X-Lawmd-Duration-Ms: 845
 * X-Lawmd-Output-Size: 2456789
 *
 * # CO
 * ...
 * </pre>
 */
@RestController
@RequestMapping("/v1")
@Tag(name = "Convert", description = "Akoma Ntoso XML → Markdown dönüşümü")
public class ConvertController {

    private static final Logger log = LoggerFactory.getLogger(ConvertController.class);
    static final MediaType TEXT_MARKDOWN_UTF8 = new MediaType("text", "markdown", StandardCharsets.UTF_8);

    @Value("${lawmd.limits.max-document-size-mb:${LAWMD_MAX_DOCUMENT_SIZE_MB:50}}")
    private int maxDocumentSizeMb;

    private final LawMarkdownConverterFactory converterFactory;

    public ConvertController(LawMarkdownConverterFactory converterFactory) {
        this.converterFactory = converterFactory;
    }

    @Operation(
            summary = "Tam Belge Dönüşümü",
            description = """
                    Akoma Ntoso (Fedlex) XML belgesini tek bir Markdown metnine dönüştürür.

                    **Başarılı yanıt:** `200 OK` + `text/markdown` body + `X-Lawmd-*` metadata header'ları.

                    Her madde `**[[Art. 40b CO]]**` başlığı, üst bölüm izi, girintili fıkra/bent
                    satırları ve (açıksa) yazar notları bloğu ile yazılır.
                    """,
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Dönüşüm başarılı, ham Markdown içerik",
                            content = @Content(mediaType = "text/markdown"),
                            headers = {
                                    @Header(name = LawmdHeaders.ARTICLE_COUNT, description = "Madde sayısı", schema = @Schema(type = "integer")),
                                    @Header(name = LawmdHeaders.NOTE_COUNT, description = "Yazar notu sayısı", schema = @Schema(type = "integer")),
                                    @Header(name = LawmdHeaders.DURATION_MS, description = "İşlem süresi (ms)", schema = @Schema(type = "integer")),
                                    @Header(name = LawmdHeaders.OUTPUT_SIZE, description = "Çıktı boyutu (byte)", schema = @Schema(type = "integer"))
                            }
                    ),
                    @ApiResponse(responseCode = "400", description = "Geçersiz istek (eksik dosya, geçersiz parametre)", content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "422", description = "XML ayrıştırılamadı veya madde içermiyor", content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping(value = "/convert", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> convert(@ModelAttribute @Valid ConvertRequestDto requestDto)
            throws IOException, DocumentParseException, MissingArticlesException {

        byte[] xml = DocumentUploads.read(requestDto.getDocument(), maxDocumentSizeMb);
        ConverterOptions options = requestDto.applyTo(converterFactory.defaultOptions());
        LawMarkdownConverter converter = converterFactory.create(options);

        log.info("Dönüşüm isteği, belge: {} byte, kanun: {}", xml.length, options.getCodeName());

        long startTime = System.nanoTime();
        ConvertedDocument document = converter.convertDocument(xml);
        long durationMs = (System.nanoTime() - startTime) / 1_000_000;

        byte[] body = document.markdown().getBytes(StandardCharsets.UTF_8);
        var headers = headers(document, durationMs, body.length);
        return new ResponseEntity<>(body, headers, HttpStatus.OK);
    }

    @Operation(
            summary = "Tek Madde Dışa Aktarımı",
            description = """
                    Belgeyi dönüştürür ve yalnızca numarası verilen maddenin Markdown bloğunu döner.
                    Son hükümler bölgesindeki maddeler de aynı numarayla aranır.
                    """,
            responses = {
                    @ApiResponse(responseCode = "200", description = "Madde bloğu", content = @Content(mediaType = "text/markdown")),
                    @ApiResponse(responseCode = "404", description = "Madde bulunamadı", content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "422", description = "XML ayrıştırılamadı veya madde içermiyor", content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping(value = "/convert/article", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> convertArticle(@ModelAttribute @Valid ArticleRequestDto requestDto)
            throws IOException, DocumentParseException, MissingArticlesException, ArticleNotFoundException {

        byte[] xml = DocumentUploads.read(requestDto.getDocument(), maxDocumentSizeMb);
        LawMarkdownConverter converter = converterFactory.create(
                requestDto.applyTo(converterFactory.defaultOptions()));
        String articleNumber = requestDto.getArticleNumber().strip();

        log.info("Tek madde isteği, madde: {}, belge: {} byte", articleNumber, xml.length);

        long startTime = System.nanoTime();
        ConvertedDocument document = converter.convertDocument(xml);
        String block = converter.renderArticle(document, articleNumber);
        long durationMs = (System.nanoTime() - startTime) / 1_000_000;

        byte[] body = block.getBytes(StandardCharsets.UTF_8);
        var headers = headers(document, durationMs, body.length);
        headers.set(LawmdHeaders.ARTICLE_NUMBER, articleNumber);
        return new ResponseEntity<>(body, headers, HttpStatus.OK);
    }

    private static HttpHeaders headers(ConvertedDocument document, long durationMs, int outputSize) {
        var headers = new HttpHeaders();
        headers.setContentType(TEXT_MARKDOWN_UTF8);
        headers.set(LawmdHeaders.ARTICLE_COUNT, String.valueOf(document.articles().size()));
        headers.set(LawmdHeaders.NOTE_COUNT, String.valueOf(document.noteCount()));
        headers.set(LawmdHeaders.DURATION_MS, String.valueOf(durationMs));
        headers.set(LawmdHeaders.OUTPUT_SIZE, String.valueOf(outputSize));
        return headers;
    }
}
