package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.application.enums.RenderMode;
import io.mersel.services.lawmd.application.models.AuthorialNote;
import io.mersel.services.lawmd.application.models.ConverterOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Tek bir dönüşüm çağrısının değişken durumu.
 * <p>
 * Son hükümler bayrağı çağrı boyunca yapışkandır: bir kez set edildikten sonra
 * aynı çağrıdaki sonraki tüm maddeler için {@code true} kalır. Not sayacı her
 * maddenin başında sıfırlanır. Çağrılar arasında paylaşılmaz.
 */
public final class ConversionContext {

    private final ConverterOptions options;

    private boolean finalSection;
    private int noteCounter;
    private final List<AuthorialNote> articleNotes = new ArrayList<>();

    public ConversionContext(ConverterOptions options) {
        this.options = options;
    }

    public ConverterOptions options() {
        return options;
    }

    /** Yeni madde: not numaralandırması 1'den başlar. */
    public void beginArticle() {
        noteCounter = 0;
        articleNotes.clear();
    }

    /**
     * Notu maddenin not tablosuna ekler.
     *
     * @return Notun madde içindeki numarası
     */
    public int registerNote(String text) {
        noteCounter++;
        articleNotes.add(new AuthorialNote(noteCounter, text));
        return noteCounter;
    }

    public List<AuthorialNote> articleNotes() {
        return List.copyOf(articleNotes);
    }

    public void enterFinalSection() {
        finalSection = true;
    }

    public boolean isFinalSection() {
        return finalSection;
    }

    public boolean rendersNotes() {
        return options.getRenderMode() == RenderMode.WITH_NOTES;
    }
}
