package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.application.interfaces.DocumentParseException;
import io.mersel.services.lawmd.infrastructure.akn.AknNames;
import io.mersel.services.lawmd.infrastructure.akn.AknNodes;
import io.mersel.services.lawmd.infrastructure.config.ConverterProperties;
import io.mersel.services.lawmd.infrastructure.diagnostics.LawmdMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import net.sf.saxon.s9api.XdmNode;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Testlerde ortak kullanılan Akoma Ntoso belge parçaları ve bileşen kurulumu.
 */
final class AknFixtures {

    static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);

    private static final AknDocumentLoader LOADER = new AknDocumentLoader();

    private AknFixtures() {
    }

    /** {@code body} içeriğini tam bir Akoma Ntoso belgesine sarar. */
    static byte[] akn(String body) {
        return ("""
                <?xml version="1.0" encoding="UTF-8"?>
                <akomaNtoso xmlns="http://docs.oasis-open.org/legaldocml/ns/akn/3.0">
                <act><body>
                """ + body + """
                </body></act>
                </akomaNtoso>
                """).getBytes(StandardCharsets.UTF_8);
    }

    static XdmNode load(String body) throws DocumentParseException {
        return LOADER.load(akn(body));
    }

    static List<XdmNode> articles(String body) throws DocumentParseException {
        return AknNodes.descendants(load(body), AknNames.ARTICLE);
    }

    static XdmNode firstArticle(String body) throws DocumentParseException {
        return articles(body).get(0);
    }

    static ArticleExtractor articleExtractor() {
        var inline = new InlineTextCollector();
        return new ArticleExtractor(new ArticleNumberExtractor(),
                new BreadcrumbResolver(inline), new ParagraphListExtractor(inline));
    }

    static LawMarkdownConverterFactory factory(MeterRegistry registry) {
        return factory(registry, new ConverterProperties());
    }

    static LawMarkdownConverterFactory factory(MeterRegistry registry, ConverterProperties properties) {
        var metrics = new LawmdMetrics(registry);
        var renderer = new MarkdownRenderer();
        return new LawMarkdownConverterFactory(LOADER, articleExtractor(), renderer,
                new DocumentAssembler(), new ArticleSplitter(renderer, metrics), metrics,
                FIXED_CLOCK, properties);
    }
}
