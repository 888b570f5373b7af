package io.mersel.services.lawmd.application.interfaces;

/**
 * XML belgesi okunamadığında veya iyi biçimli (well-formed) olmadığında fırlatılır.
 * Controller bu istisnayı {@code 422 Unprocessable Entity} olarak çevirir.
 */
public class DocumentParseException extends ConversionException {

    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
