package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.application.models.Article;
import io.mersel.services.lawmd.application.models.ContentLine;
import io.mersel.services.lawmd.infrastructure.akn.AknNames;
import io.mersel.services.lawmd.infrastructure.akn.AknNodes;
import net.sf.saxon.s9api.XdmNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tek bir {@code article} elementinden {@link Article} modelini üretir.
 * <p>
 * Sıra önemlidir: numara, kenar notu izi (son hükümler bayrağını set edebilir),
 * ardından gövde satırları ve notlar.
 */
@Component
public class ArticleExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArticleExtractor.class);

    private final ArticleNumberExtractor numberExtractor;
    private final BreadcrumbResolver breadcrumbResolver;
    private final ParagraphListExtractor paragraphExtractor;

    public ArticleExtractor(ArticleNumberExtractor numberExtractor,
                            BreadcrumbResolver breadcrumbResolver,
                            ParagraphListExtractor paragraphExtractor) {
        this.numberExtractor = numberExtractor;
        this.breadcrumbResolver = breadcrumbResolver;
        this.paragraphExtractor = paragraphExtractor;
    }

    /**
     * Belgedeki tüm maddeleri belge sırasıyla çıkarır.
     *
     * @return Hiç madde yoksa boş liste
     */
    public List<Article> extractAll(XdmNode document, ConversionContext context) {
        var articles = new ArrayList<Article>();
        for (XdmNode node : AknNodes.descendants(document, AknNames.ARTICLE)) {
            articles.add(extract(node, context));
        }
        return articles;
    }

    public Article extract(XdmNode article, ConversionContext context) {
        context.beginArticle();

        String number = numberExtractor.extract(article);
        List<String> breadcrumb = breadcrumbResolver.resolve(article, context);
        List<ContentLine> lines = paragraphExtractor.extract(article, context);

        var result = new Article(number, breadcrumb, context.isFinalSection(), lines, context.articleNotes());
        log.debug("Madde çıkarıldı: '{}', {} satır, {} not, son hükümler: {}",
                number, lines.size(), result.notes().size(), result.finalSection());
        return result;
    }
}
