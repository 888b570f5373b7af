package io.mersel.services.lawmd.web.infrastructure;

/**
 * Law Markdown Service özel HTTP response header sabitleri.
 * <p>
 * Dönüşüm endpoint'leri başarılı yanıtlarda {@code text/markdown} body ile birlikte
 * bu header'ları döner.
 *
 * <pre>
 * HTTP/1.1 200 OK
 * Content-Type: text/markdown; charset=utf-8
 * X-Lawmd-Article-Count: 1275
 * X-Lawmd-Note-Count: 3110
 * X-Lawmd-Duration-Ms: 845
 * X-Lawmd-Output-Size: 2456789
 * </pre>
 */
public final class LawmdHeaders {

    private LawmdHeaders() {
    }

    /** Dönüştürülen madde sayısı. */
    public static final String ARTICLE_COUNT = "X-Lawmd-Article-Count";

    /** Toplam yazar notu sayısı. */
    public static final String NOTE_COUNT = "X-Lawmd-Note-Count";

    /** İşlem süresi (milisaniye). */
    public static final String DURATION_MS = "X-Lawmd-Duration-Ms";

    /** Çıktı boyutu (byte). */
    public static final String OUTPUT_SIZE = "X-Lawmd-Output-Size";

    /** Tek madde dışa aktarımında dönen maddenin numarası. */
    public static final String ARTICLE_NUMBER = "X-Lawmd-Article-Number";
}
