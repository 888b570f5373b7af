package io.mersel.services.lawmd.application.enums;

/**
 * Yazar notlarının (authorialNote) Markdown çıktısında nasıl gösterileceği.
 * <p>
 * Her iki modda da notlar ayrıştırılır ve madde içinde sıralı numara alır;
 * fark yalnızca çıktıdadır.
 */
public enum RenderMode {

    /** Satır içinde {@code [n]} işareti ve madde sonunda "Notes" bloğu. */
    WITH_NOTES,

    /** Ne satır içi işaret ne de not bloğu üretilir. */
    WITHOUT_NOTES
}
