package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.application.models.ConverterOptions;
import io.mersel.services.lawmd.infrastructure.config.ConverterProperties;
import io.mersel.services.lawmd.infrastructure.diagnostics.LawmdMetrics;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * {@link LawMarkdownConverter} örnekleri üretir.
 * <p>
 * Bileşenler durumsuz singleton'lardır; her dönüştürücü kendi ayarlarını ve
 * kendi dosya adı ek sayacını taşır. HTTP katmanı istek başına yeni bir
 * dönüştürücü oluşturur, böylece istekler ek sayacını paylaşmaz.
 */
@Component
public class LawMarkdownConverterFactory {

    private final AknDocumentLoader loader;
    private final ArticleExtractor articleExtractor;
    private final MarkdownRenderer renderer;
    private final DocumentAssembler assembler;
    private final ArticleSplitter splitter;
    private final LawmdMetrics metrics;
    private final Clock clock;
    private final ConverterProperties properties;

    public LawMarkdownConverterFactory(AknDocumentLoader loader,
                                       ArticleExtractor articleExtractor,
                                       MarkdownRenderer renderer,
                                       DocumentAssembler assembler,
                                       ArticleSplitter splitter,
                                       LawmdMetrics metrics,
                                       Clock clock,
                                       ConverterProperties properties) {
        this.loader = loader;
        this.articleExtractor = articleExtractor;
        this.renderer = renderer;
        this.assembler = assembler;
        this.splitter = splitter;
        this.metrics = metrics;
        this.clock = clock;
        this.properties = properties;
    }

    /** Yapılandırmadaki ayarlarla bir dönüştürücü. */
    public LawMarkdownConverter create() {
        return create(defaultOptions());
    }

    public LawMarkdownConverter create(ConverterOptions options) {
        return new LawMarkdownConverter(options, loader, articleExtractor, renderer,
                assembler, splitter, metrics, clock);
    }

    /** İstek bazlı değişikliklerin üzerine uygulanacağı yapılandırılmış ayarlar. */
    public ConverterOptions defaultOptions() {
        return properties.toOptions();
    }
}
