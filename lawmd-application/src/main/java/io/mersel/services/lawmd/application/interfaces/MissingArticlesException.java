package io.mersel.services.lawmd.application.interfaces;

/**
 * Belge ayrıştırıldı ancak hiç {@code article} elementi içermiyor.
 * <p>
 * Ayrıştırma hatası değil, içerik eksikliği hatasıdır.
 */
public class MissingArticlesException extends ConversionException {

    public MissingArticlesException(String message) {
        super(message);
    }
}
