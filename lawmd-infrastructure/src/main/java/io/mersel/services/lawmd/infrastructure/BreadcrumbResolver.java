package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.infrastructure.akn.AknNames;
import io.mersel.services.lawmd.infrastructure.akn.AknNodes;
import net.sf.saxon.s9api.XdmNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Maddenin üst {@code level} başlıklarından kenar notu izini (breadcrumb) oluşturur.
 * <p>
 * Başlıklardan biri son/geçiş hükümleri anahtar kelimesi içeriyorsa çağrı
 * bağlamındaki yapışkan son hükümler bayrağı set edilir.
 */
@Component
public class BreadcrumbResolver {

    private static final Logger log = LoggerFactory.getLogger(BreadcrumbResolver.class);

    private final InlineTextCollector inlineText;

    public BreadcrumbResolver(InlineTextCollector inlineText) {
        this.inlineText = inlineText;
    }

    /**
     * @return Kökten maddeye doğru başlık listesi; hiç {@code level} yoksa boş liste
     */
    public List<String> resolve(XdmNode article, ConversionContext context) {
        Deque<String> trail = new ArrayDeque<>();
        List<String> keywords = context.options().getFinalSectionKeywords();

        for (XdmNode current = article; current != null; current = current.getParent()) {
            if (!AknNodes.isElement(current, AknNames.LEVEL)) {
                continue;
            }
            var heading = AknNodes.firstChild(current, AknNames.HEADING);
            if (heading.isEmpty()) {
                continue;
            }
            String text = inlineText.plainText(heading.get());
            if (text.isEmpty()) {
                continue;
            }
            if (!context.isFinalSection() && keywords.stream().anyMatch(text::contains)) {
                log.debug("Son hükümler bölümüne girildi: {}", text);
                context.enterFinalSection();
            }
            trail.addFirst(text);
        }
        return List.copyOf(trail);
    }
}
