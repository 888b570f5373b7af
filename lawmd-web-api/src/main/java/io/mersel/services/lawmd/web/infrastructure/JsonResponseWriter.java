package io.mersel.services.lawmd.web.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;

import java.io.IOException;

/**
 * Servlet filter katmanında JSON yanıt yazmak için yardımcı sınıf.
 * <p>
 * Spring MVC'nin {@code ResponseEntity} serileştirmesi filter katmanında
 * kullanılamadığı için Jackson {@link ObjectMapper} ile nesneyi doğrudan
 * {@code HttpServletResponse}'a yazar:
 * <pre>
 * JsonResponseWriter.write(response, 429, new ErrorResponse("Rate limit exceeded", "..."));
 * </pre>
 */
public final class JsonResponseWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonResponseWriter() {
    }

    /**
     * Verilen nesneyi JSON olarak HTTP yanıtına yazar.
     *
     * @param status HTTP durum kodu (ör: 429)
     * @param body   Serileştirilecek nesne (record, Map, POJO vb.)
     * @throws IOException yazma hatası
     */
    public static void write(HttpServletResponse response, int status, Object body) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        MAPPER.writeValue(response.getOutputStream(), body);
    }
}
