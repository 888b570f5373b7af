package io.mersel.services.lawmd.application.models;

/**
 * Madde içindeki yazar notu.
 *
 * @param id   Madde içinde 1'den başlayan, kesintisiz artan numara
 * @param text Notun tüm metni
 */
public record AuthorialNote(int id, String text) {
}
