package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.infrastructure.akn.AknNames;
import io.mersel.services.lawmd.infrastructure.akn.AknNodes;
import net.sf.saxon.s9api.XdmNode;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maddenin {@code num} etiketinden madde numarasını çıkarır ("Art. 40b" → "40b").
 */
@Component
public class ArticleNumberExtractor {

    private static final Pattern ARTICLE_NUMBER = Pattern.compile("(\\d+[a-z]?)", Pattern.CASE_INSENSITIVE);

    /**
     * @return Rakamlar + isteğe bağlı tek harf; {@code num} yoksa veya eşleşme yoksa boş metin
     *         (numarasız ek maddeler için geçerli bir durum)
     */
    public String extract(XdmNode article) {
        return AknNodes.firstDescendant(article, AknNames.NUM)
                .map(AknNodes::text)
                .map(ArticleNumberExtractor::match)
                .orElse("");
    }

    private static String match(String label) {
        Matcher matcher = ARTICLE_NUMBER.matcher(label);
        return matcher.find() ? matcher.group(1) : "";
    }
}
