package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.application.enums.RenderMode;
import io.mersel.services.lawmd.application.models.Article;
import io.mersel.services.lawmd.application.models.AuthorialNote;
import io.mersel.services.lawmd.application.models.ContentLine;
import io.mersel.services.lawmd.application.models.ConverterOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Tek bir maddeyi Markdown bloğuna çevirir.
 * <p>
 * Blok yapısı:
 * <pre>
 * **[[Art. 40b CO]]**
 * [Titre premier &lt;&lt; Chapitre 2]
 *
 * **&lt;span style="color:yellow"&gt;&lt;small&gt;1&lt;/small&gt;&lt;/span&gt;** Metin
 *    Girintili metin
 *
 * ---
 * **Notes :**
 * &lt;span style='color:red'&gt;[1]&lt;/span&gt; Not metni
 * </pre>
 * Blok her zaman boş bir satırla biter.
 */
@Component
public class MarkdownRenderer {

    static final String INDENT = "   ";

    public String render(Article article, ConverterOptions options) {
        var lines = new ArrayList<String>();

        lines.add("**[[" + headerTitle(article, options) + "]]**");
        if (!article.breadcrumb().isEmpty()) {
            lines.add("[" + String.join(options.getBreadcrumbSeparator(), article.breadcrumb()) + "]");
        }
        lines.add("");

        for (ContentLine line : article.lines()) {
            lines.add(renderLine(line));
        }

        if (options.getRenderMode() == RenderMode.WITH_NOTES && !article.notes().isEmpty()) {
            lines.add("");
            lines.add("---");
            lines.add("**Notes :**");
            for (AuthorialNote note : article.notes()) {
                lines.add("<span style='color:red'>[" + note.id() + "]</span> " + note.text());
            }
        }
        lines.add("");
        return String.join("\n", lines);
    }

    /**
     * Başlık satırının köşeli parantez içindeki kısmı, ör. {@code Art. 40b CO}.
     * Son hükümler bölgesindeki maddelerde ek önek kullanılır.
     */
    public String headerTitle(Article article, ConverterOptions options) {
        String prefix = article.finalSection()
                ? options.getSupplementaryPrefix()
                : options.getArticlePrefix();
        if (article.hasNumber()) {
            return prefix + " " + article.number() + " " + options.getCodeName();
        }
        return prefix + " " + options.getCodeName();
    }

    static String renderLine(ContentLine line) {
        String indent = INDENT.repeat(line.level());
        if (line.isLabeled()) {
            return indent + "**<span style=\"color:yellow\"><small>" + line.label()
                    + "</small></span>** " + line.text();
        }
        return indent + line.text();
    }
}
