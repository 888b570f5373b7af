package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.infrastructure.akn.AknNames;
import io.mersel.services.lawmd.infrastructure.akn.AknNodes;
import net.sf.saxon.s9api.Axis;
import net.sf.saxon.s9api.XdmNode;
import net.sf.saxon.s9api.XdmSequenceIterator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Paragraf benzeri bir düğümün ({@code p}, {@code listIntroduction} ...) satır içi metnini toplar.
 * <p>
 * Alt düğümler belge sırasıyla dolaşılır:
 * <ul>
 *   <li>{@code num} alt ağaçları atlanır; numaralar ayrıca etiket olarak basıldığından
 *       metinde ikinci kez görünmemelidir. Arkasından gelen metin korunur.</li>
 *   <li>Her {@code authorialNote} maddenin sıradaki not numarasını alır ve not tablosuna
 *       yazılır. {@code WITH_NOTES} modunda metne {@code [n]} işareti eklenir.</li>
 *   <li>Diğer tüm metin parçaları tek boşlukla birleştirilir.</li>
 * </ul>
 */
@Component
public class InlineTextCollector {

    /**
     * Metni toplar ve karşılaşılan notları bağlama kaydeder.
     */
    public String collect(XdmNode node, ConversionContext context) {
        var parts = new ArrayList<String>();
        walk(node, parts, context);
        return String.join(" ", parts).strip();
    }

    /**
     * Not kaydetmeden düz metin; notların içeriği dahil edilmez.
     * Bölüm başlıkları (breadcrumb) için kullanılır.
     */
    public String plainText(XdmNode node) {
        var parts = new ArrayList<String>();
        walk(node, parts, null);
        return String.join(" ", parts).strip();
    }

    /**
     * Tek bir yazar notunu kaydeder.
     *
     * @return {@code WITH_NOTES} modunda satır içi işaret, aksi halde boş metin
     */
    public String registerNote(XdmNode note, ConversionContext context) {
        var fragments = new ArrayList<String>();
        XdmSequenceIterator<XdmNode> it = note.axisIterator(Axis.DESCENDANT);
        while (it.hasNext()) {
            XdmNode textNode = it.next();
            if (AknNodes.isText(textNode)) {
                String fragment = AknNodes.normalize(textNode.getStringValue());
                if (!fragment.isEmpty()) {
                    fragments.add(fragment);
                }
            }
        }
        int id = context.registerNote(String.join(" ", fragments));
        return context.rendersNotes() ? marker(id) : "";
    }

    static String marker(int id) {
        return "<sup style='color:red'>[" + id + "]</sup>";
    }

    private void walk(XdmNode node, List<String> parts, ConversionContext context) {
        for (XdmNode child : node.children()) {
            if (AknNodes.isText(child)) {
                String fragment = AknNodes.normalize(child.getStringValue());
                if (!fragment.isEmpty()) {
                    parts.add(fragment);
                }
            } else if (AknNodes.isElement(child, AknNames.NUM)) {
                // numara etiket olarak ayrıca basılır
            } else if (AknNodes.isElement(child, AknNames.AUTHORIAL_NOTE)) {
                if (context != null) {
                    String marker = registerNote(child, context);
                    if (!marker.isEmpty()) {
                        parts.add(marker);
                    }
                }
            } else {
                walk(child, parts, context);
            }
        }
    }
}
