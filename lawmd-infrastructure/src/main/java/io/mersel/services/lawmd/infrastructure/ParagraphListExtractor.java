package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.application.enums.OrdinalWord;
import io.mersel.services.lawmd.application.models.ContentLine;
import io.mersel.services.lawmd.infrastructure.akn.AknNames;
import io.mersel.services.lawmd.infrastructure.akn.AknNodes;
import net.sf.saxon.s9api.XdmNode;
import net.sf.saxon.s9api.XdmNodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Madde gövdesindeki fıkra ve bentleri belge sırasıyla, girinti seviyeleriyle çıkarır.
 * <p>
 * Numaralandırma kuralları:
 * <ul>
 *   <li>Fıkra numarası fıkra başına en fazla bir satıra yazılır: ilk metin satırına,
 *       liste girişine ya da (giriş yoksa) listenin ilk bendine.</li>
 *   <li>Maddede tek numaralı fıkra varsa ve içeriği doğrudan bir listeden ibaretse
 *       numara hiç yazılmaz; bentler kendi etiketlerini korur (ör. Art. 40b).</li>
 *   <li>Aynı listede tekrar eden bent etiketleri bis, ter, quater ... ekleriyle ayrılır.</li>
 * </ul>
 * Elementten sonra gelen metin (tail) her zaman etiketsiz ayrı satırdır.
 */
@Component
public class ParagraphListExtractor {

    private static final Logger log = LoggerFactory.getLogger(ParagraphListExtractor.class);

    private final InlineTextCollector inlineText;

    public ParagraphListExtractor(InlineTextCollector inlineText) {
        this.inlineText = inlineText;
    }

    /**
     * Maddenin içerik satırlarını çıkarır. Notlar {@code context} üzerindeki
     * madde not tablosuna yazılır.
     */
    public List<ContentLine> extract(XdmNode article, ConversionContext context) {
        var lines = new ArrayList<ContentLine>();
        List<XdmNode> paragraphs = AknNodes.descendants(article, AknNames.PARAGRAPH);
        long numberedCount = paragraphs.stream()
                .filter(p -> !paragraphNumber(p).isEmpty())
                .count();

        for (XdmNode paragraph : paragraphs) {
            String number = paragraphNumber(paragraph);
            Optional<XdmNode> content = AknNodes.firstDescendant(paragraph, AknNames.CONTENT);
            if (content.isEmpty()) {
                lines.add(new ContentLine(number, "", 0));
                continue;
            }
            if (numberedCount == 1 && !number.isEmpty() && consistsOfList(content.get())) {
                log.debug("Tek numaralı fıkra doğrudan liste içeriyor, fıkra numarası '{}' yazılmayacak", number);
                number = "";
            }
            new BodyWalk(lines, context, number).element(content.get(), 0);
        }
        return lines;
    }

    private static String paragraphNumber(XdmNode paragraph) {
        return AknNodes.firstDescendant(paragraph, AknNames.NUM)
                .map(AknNodes::text)
                .orElse("");
    }

    /**
     * İçerik doğrudan bir liste barındırıyor ve yanında düz metin paragrafı yok mu?
     */
    private static boolean consistsOfList(XdmNode content) {
        if (!AknNodes.hasChild(content, AknNames.BLOCK_LIST)) {
            return false;
        }
        return AknNodes.children(content, AknNames.P).stream()
                .allMatch(p -> AknNodes.text(p).isEmpty());
    }

    /**
     * Tek bir fıkranın içerik ağacını dolaşır. Bekleyen fıkra numarası
     * ilk kullanıldığı satırda tüketilir.
     */
    private final class BodyWalk {

        private final List<ContentLine> lines;
        private final ConversionContext context;
        private String pendingNumber;

        BodyWalk(List<ContentLine> lines, ConversionContext context, String paragraphNumber) {
            this.lines = lines;
            this.context = context;
            this.pendingNumber = paragraphNumber;
        }

        private String takePendingNumber() {
            String number = pendingNumber;
            pendingNumber = "";
            return number;
        }

        void element(XdmNode node, int level) {
            boolean afterElement = false;
            for (XdmNode child : node.children()) {
                if (AknNodes.isText(child)) {
                    String text = AknNodes.normalize(child.getStringValue());
                    if (!text.isEmpty()) {
                        String label = afterElement ? "" : takePendingNumber();
                        lines.add(new ContentLine(label, text, level));
                    }
                    continue;
                }
                if (child.getNodeKind() != XdmNodeKind.ELEMENT) {
                    continue;
                }
                afterElement = true;

                if (AknNodes.isElement(child, AknNames.BLOCK_LIST)) {
                    blockList(child, level, takePendingNumber());
                } else if (AknNodes.isElement(child, AknNames.P)) {
                    String text = inlineText.collect(child, context);
                    if (!text.isEmpty()) {
                        lines.add(new ContentLine(takePendingNumber(), text, level));
                    }
                } else if (AknNodes.isElement(child, AknNames.AUTHORIAL_NOTE)) {
                    String marker = inlineText.registerNote(child, context);
                    if (!marker.isEmpty()) {
                        lines.add(ContentLine.unlabeled(marker, level));
                    }
                } else if (!AknNodes.isElement(child, AknNames.NUM)
                        && !AknNodes.isElement(child, AknNames.PARAGRAPH)) {
                    // iç içe fıkralar üst döngüde kendi sırasında işlenir
                    element(child, level);
                }
            }
        }

        /**
         * Listeyi işler. {@code parentNumber} liste girişine, giriş yoksa ilk bende bir kez yazılır.
         * Bentler {@code level + 1}, iç listelerin bentleri {@code level + 2} seviyesindedir.
         */
        void blockList(XdmNode list, int level, String parentNumber) {
            String number = parentNumber;
            List<XdmNode> items = AknNodes.children(list, AknNames.ITEM);

            // Tek bendi olan ve o bendin içinde alt liste bulunan liste:
            // bendin metni liste girişi gibi yazılır.
            if (items.size() == 1 && AknNodes.hasChild(items.get(0), AknNames.BLOCK_LIST)) {
                Optional<XdmNode> intro = AknNodes.firstChild(list, AknNames.LIST_INTRODUCTION);
                if (intro.isPresent()) {
                    number = introduction(intro.get(), level, number);
                }
                XdmNode item = items.get(0);
                for (XdmNode p : AknNodes.children(item, AknNames.P)) {
                    String text = inlineText.collect(p, context);
                    if (!text.isEmpty()) {
                        lines.add(new ContentLine(number, text, level));
                        number = "";
                    }
                }
                for (XdmNode nested : AknNodes.children(item, AknNames.BLOCK_LIST)) {
                    blockList(nested, level + 1, "");
                }
                trailingText(list, item, level + 1);
                AknNodes.firstChild(list, AknNames.LIST_WRAP_UP).ifPresent(w -> wrapUp(w, level));
                return;
            }

            Map<String, Integer> occurrences = new HashMap<>();
            boolean afterItem = false;
            for (XdmNode child : list.children()) {
                if (AknNodes.isText(child)) {
                    String text = AknNodes.normalize(child.getStringValue());
                    if (!text.isEmpty()) {
                        lines.add(ContentLine.unlabeled(text, afterItem ? level + 1 : level));
                    }
                } else if (AknNodes.isElement(child, AknNames.LIST_INTRODUCTION)) {
                    number = introduction(child, level, number);
                } else if (AknNodes.isElement(child, AknNames.ITEM)) {
                    afterItem = true;
                    String label = displayLabel(child, occurrences);
                    String text = itemText(child);
                    if (!number.isEmpty()) {
                        lines.add(new ContentLine(number, text, level + 1));
                        number = "";
                    } else {
                        lines.add(new ContentLine(label, text, level + 1));
                    }
                    for (XdmNode nested : AknNodes.children(child, AknNames.BLOCK_LIST)) {
                        blockList(nested, level + 1, "");
                    }
                } else if (AknNodes.isElement(child, AknNames.LIST_WRAP_UP)) {
                    wrapUp(child, level);
                }
            }
        }

        /** Liste kapanış metni, liste seviyesinde etiketsiz satır. */
        private void wrapUp(XdmNode wrapUp, int level) {
            String text = inlineText.collect(wrapUp, context);
            if (!text.isEmpty()) {
                lines.add(ContentLine.unlabeled(text, level));
            }
        }

        /**
         * @return Giriş satırı yazıldıysa boş metin, aksi halde hâlâ bekleyen numara
         */
        private String introduction(XdmNode intro, int level, String number) {
            String text = inlineText.collect(intro, context);
            if (text.isEmpty()) {
                return number;
            }
            lines.add(new ContentLine(number, text, level));
            return "";
        }

        private String itemText(XdmNode item) {
            var parts = new ArrayList<String>();
            for (XdmNode p : AknNodes.children(item, AknNames.P)) {
                String text = inlineText.collect(p, context);
                if (!text.isEmpty()) {
                    parts.add(text);
                }
            }
            return String.join(" ", parts);
        }

        /** Bendden sonra, aynı liste içinde gelen metin. */
        private void trailingText(XdmNode list, XdmNode item, int level) {
            boolean afterItem = false;
            for (XdmNode child : list.children()) {
                if (child.equals(item)) {
                    afterItem = true;
                } else if (afterItem && AknNodes.isText(child)) {
                    String text = AknNodes.normalize(child.getStringValue());
                    if (!text.isEmpty()) {
                        lines.add(ContentLine.unlabeled(text, level));
                    }
                } else if (afterItem) {
                    return;
                }
            }
        }
    }

    /**
     * Bendin görüntülenecek etiketi. Aynı temel etiketin ikinci ve sonraki
     * tekrarlarına sıra eki eklenir: "c." → "c. bis.", "c. ter." ...
     */
    static String displayLabel(XdmNode item, Map<String, Integer> occurrences) {
        String label = AknNodes.firstChild(item, AknNames.NUM)
                .map(AknNodes::text)
                .orElse("");
        String base = baseLabel(label);
        if (base.isEmpty()) {
            return "";
        }
        int count = occurrences.merge(base, 1, Integer::sum);
        if (count == 1) {
            return label;
        }
        return label + " " + OrdinalWord.suffixFor(count) + ".";
    }

    private static String baseLabel(String label) {
        String base = label;
        while (base.endsWith(".")) {
            base = base.substring(0, base.length() - 1);
        }
        return base.strip();
    }
}
