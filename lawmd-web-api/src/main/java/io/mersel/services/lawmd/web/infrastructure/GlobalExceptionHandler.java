package io.mersel.services.lawmd.web.infrastructure;

import io.mersel.services.lawmd.application.interfaces.ArticleNotFoundException;
import io.mersel.services.lawmd.application.interfaces.DocumentParseException;
import io.mersel.services.lawmd.application.interfaces.MissingArticlesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Global hata yöneticisi, RFC 7807 Problem Details.
 * <p>
 * Tüm controller'lardan çıkan istisnaları tutarlı bir JSON formatta döner:
 * <pre>
 * {
 *   "type": "https://mersel.io/lawmd/errors/parse-failed",
 *   "title": "Belge Ayrıştırılamadı",
 *   "status": 422,
 *   "detail": "XML parse hatası: ..."
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    static final String ERROR_BASE_URI = "https://mersel.io/lawmd/errors/";

    /**
     * XML okunamadı veya iyi biçimli değil → 422 Unprocessable Entity.
     */
    @ExceptionHandler(DocumentParseException.class)
    public ProblemDetail handleParseException(DocumentParseException ex) {
        log.warn("Ayrıştırma hatası: {}", ex.getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(),
                "parse-failed", "Belge Ayrıştırılamadı");
    }

    /**
     * Belgede hiç madde yok → 422 Unprocessable Entity.
     */
    @ExceptionHandler(MissingArticlesException.class)
    public ProblemDetail handleMissingArticles(MissingArticlesException ex) {
        log.warn("Maddesiz belge: {}", ex.getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(),
                "no-articles", "Madde Bulunamadı");
    }

    @ExceptionHandler(ArticleNotFoundException.class)
    public ProblemDetail handleArticleNotFound(ArticleNotFoundException ex) {
        log.info("İstenen madde yok: {}", ex.getArticleNumber());
        var problem = problem(HttpStatus.NOT_FOUND, ex.getMessage(),
                "article-not-found", "Madde Yok");
        problem.setProperty("articleNumber", ex.getArticleNumber());
        return problem;
    }

    /**
     * Dosya boyutu aşımı → 413 Payload Too Large.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ProblemDetail handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Dosya boyutu aşımı: {}", ex.getMessage());
        return problem(HttpStatus.PAYLOAD_TOO_LARGE,
                "Yüklenen dosya boyutu izin verilen sınırı aşıyor",
                "payload-too-large", "Dosya Boyutu Aşımı");
    }

    /**
     * Genel istek hatası → 400 Bad Request.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Geçersiz parametre: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request", "Geçersiz İstek");
    }

    /**
     * Bean Validation hatası → 400 Bad Request.
     */
    @ExceptionHandler(BindException.class)
    public ProblemDetail handleBindException(BindException ex) {
        String detail = ex.getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Doğrulama hatası: {}", detail);
        return problem(HttpStatus.BAD_REQUEST, detail, "validation-error", "Doğrulama Hatası");
    }

    /**
     * Beklenmeyen hata → 500 Internal Server Error.
     */
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex) {
        log.error("Beklenmeyen hata: {}", ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "Beklenmeyen bir hata oluştu. Lütfen tekrar deneyin.",
                "internal-error", "Sunucu Hatası");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        var problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(ERROR_BASE_URI + type));
        problem.setTitle(title);
        return problem;
    }
}
