package io.mersel.services.lawmd.application.models;

/**
 * Bir maddenin gövdesindeki tek satır: fıkra, bent ya da bağımsız metin.
 *
 * @param label Fıkra numarası ("1"), bent etiketi ("a.", "c. bis.") veya boş
 * @param text  Düz metin; yazar notları render moduna göre işaretle değiştirilmiş
 * @param level Girinti seviyesi (0 = üst düzey fıkra)
 */
public record ContentLine(
        String label,
        String text,
        int level
) {

    public ContentLine {
        label = label == null ? "" : label;
        text = text == null ? "" : text;
        if (level < 0) {
            throw new IllegalArgumentException("Girinti seviyesi negatif olamaz: " + level);
        }
    }

    public static ContentLine unlabeled(String text, int level) {
        return new ContentLine("", text, level);
    }

    public boolean isLabeled() {
        return !label.isEmpty();
    }
}
