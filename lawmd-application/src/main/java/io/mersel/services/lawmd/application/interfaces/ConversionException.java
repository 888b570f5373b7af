package io.mersel.services.lawmd.application.interfaces;

/**
 * Dönüşüm çağrısını sonlandıran hataların ortak üst sınıfı.
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
