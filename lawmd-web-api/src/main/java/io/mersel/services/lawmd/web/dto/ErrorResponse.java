package io.mersel.services.lawmd.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Filter katmanındaki hata yanıtları için JSON modeli.
 * <p>
 * Örnek çıktı:
 * <pre>
 * {"error": "Rate limit exceeded", "message": "Dakika başına maksimum 30 istek. Lütfen bekleyin."}
 * </pre>
 *
 * @param error   Hata kategorisi
 * @param message Kullanıcıya gösterilecek açıklayıcı mesaj
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message) {
}
