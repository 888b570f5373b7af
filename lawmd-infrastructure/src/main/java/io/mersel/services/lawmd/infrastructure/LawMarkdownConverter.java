package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.application.interfaces.ArticleNotFoundException;
import io.mersel.services.lawmd.application.interfaces.DocumentParseException;
import io.mersel.services.lawmd.application.interfaces.IArticleSplitter;
import io.mersel.services.lawmd.application.interfaces.ILawDocumentConverter;
import io.mersel.services.lawmd.application.interfaces.MissingArticlesException;
import io.mersel.services.lawmd.application.models.Article;
import io.mersel.services.lawmd.application.models.ConvertedDocument;
import io.mersel.services.lawmd.application.models.ConverterOptions;
import io.mersel.services.lawmd.application.models.SplitResult;
import io.mersel.services.lawmd.infrastructure.diagnostics.LawmdMetrics;
import net.sf.saxon.s9api.XdmNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Saxon HE tabanlı Akoma Ntoso → Markdown dönüştürücü.
 * <p>
 * Örnekler {@link LawMarkdownConverterFactory} ile oluşturulur ve ayarları
 * ömürleri boyunca değişmez. Dönüşüm durumu (son hükümler bayrağı, not sayaçları)
 * her çağrıda yeni bir {@link ConversionContext} içinde tutulur; örnek üzerinde
 * kalan tek değişken durum bölme işleminin {@link FilenameSuffixState}'idir.
 * Bu nedenle bir örnek aynı anda birden fazla thread tarafından bölme için
 * kullanılmamalıdır.
 */
public class LawMarkdownConverter implements ILawDocumentConverter, IArticleSplitter {

    private static final Logger log = LoggerFactory.getLogger(LawMarkdownConverter.class);

    private final ConverterOptions options;
    private final AknDocumentLoader loader;
    private final ArticleExtractor articleExtractor;
    private final MarkdownRenderer renderer;
    private final DocumentAssembler assembler;
    private final ArticleSplitter splitter;
    private final LawmdMetrics metrics;
    private final Clock clock;
    private final FilenameSuffixState suffixState;

    LawMarkdownConverter(ConverterOptions options,
                         AknDocumentLoader loader,
                         ArticleExtractor articleExtractor,
                         MarkdownRenderer renderer,
                         DocumentAssembler assembler,
                         ArticleSplitter splitter,
                         LawmdMetrics metrics,
                         Clock clock) {
        this.options = options;
        this.loader = loader;
        this.articleExtractor = articleExtractor;
        this.renderer = renderer;
        this.assembler = assembler;
        this.splitter = splitter;
        this.metrics = metrics;
        this.clock = clock;
        this.suffixState = new FilenameSuffixState(options.getInitialSuffixCounter());
    }

    public ConverterOptions getOptions() {
        return options;
    }

    /** Bölme işleminin güncel ek sayacı. */
    public int getSuffixCounter() {
        return suffixState.counter();
    }

    // ── Dönüşüm ────────────────────────────────────────────────────

    @Override
    public String convert(Path xmlFile) throws DocumentParseException, MissingArticlesException {
        long startTime = System.nanoTime();
        XdmNode document = load(() -> loader.load(xmlFile), startTime);
        return convert(document, startTime).markdown();
    }

    @Override
    public String convert(Path xmlFile, Path outputFile)
            throws DocumentParseException, MissingArticlesException, IOException {
        String markdown = convert(xmlFile);
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputFile, markdown, options.getOutputEncoding());
        log.info("Markdown dosyaya yazıldı: {}", outputFile);
        return markdown;
    }

    @Override
    public ConvertedDocument convertDocument(byte[] xmlContent)
            throws DocumentParseException, MissingArticlesException {
        long startTime = System.nanoTime();
        XdmNode document = load(() -> loader.load(xmlContent), startTime);
        return convert(document, startTime);
    }

    @Override
    public String renderArticle(ConvertedDocument document, String articleNumber)
            throws ArticleNotFoundException {
        Article article = document.findArticle(articleNumber)
                .orElseThrow(() -> new ArticleNotFoundException(articleNumber));
        return renderer.render(article, options);
    }

    // ── Bölme ──────────────────────────────────────────────────────

    @Override
    public SplitResult split(String markdown, Path outputDirectory, String filenamePattern) {
        return splitter.split(markdown, outputDirectory, filenamePattern, options, suffixState);
    }

    @Override
    public SplitResult split(ConvertedDocument document, Path outputDirectory, String filenamePattern) {
        return splitter.split(document.articles(), outputDirectory, filenamePattern, options, suffixState);
    }

    // ── İç akış ────────────────────────────────────────────────────

    private XdmNode load(DocumentSource source, long startTime) throws DocumentParseException {
        try {
            return source.load();
        } catch (DocumentParseException e) {
            metrics.recordConversion("parse_failed", 0, elapsedMs(startTime), 0);
            throw e;
        }
    }

    private ConvertedDocument convert(XdmNode document, long startTime) throws MissingArticlesException {
        var context = new ConversionContext(options);
        List<Article> articles = articleExtractor.extractAll(document, context);
        if (articles.isEmpty()) {
            metrics.recordConversion("no_articles", 0, elapsedMs(startTime), 0);
            throw new MissingArticlesException("XML belgesinde madde (article) bulunamadı");
        }

        var blocks = new ArrayList<String>(articles.size());
        for (Article article : articles) {
            blocks.add(renderer.render(article, options));
        }

        LocalDateTime generatedAt = LocalDateTime.now(clock);
        String markdown = assembler.assemble(options.getCodeName(), generatedAt, blocks);

        long durationMs = elapsedMs(startTime);
        int outputBytes = markdown.getBytes(options.getOutputEncoding()).length;
        metrics.recordConversion("success", articles.size(), durationMs, outputBytes);
        log.info("Dönüşüm tamamlandı: {} madde, {} byte, {} ms", articles.size(), outputBytes, durationMs);

        return new ConvertedDocument(options.getCodeName(), generatedAt, articles, markdown);
    }

    private static long elapsedMs(long startTime) {
        return (System.nanoTime() - startTime) / 1_000_000;
    }

    @FunctionalInterface
    private interface DocumentSource {
        XdmNode load() throws DocumentParseException;
    }
}
