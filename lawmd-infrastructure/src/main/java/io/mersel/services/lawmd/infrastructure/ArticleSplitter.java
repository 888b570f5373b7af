package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.application.models.Article;
import io.mersel.services.lawmd.application.models.ConverterOptions;
import io.mersel.services.lawmd.application.models.SplitResult;
import io.mersel.services.lawmd.infrastructure.diagnostics.LawmdMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Birleştirilmiş belgeyi madde başına bir {@code .md} dosyasına yazar.
 * <p>
 * İki giriş noktası aynı yazma ve dosya adı mantığını paylaşır: Markdown
 * metninden bölme (madde başlık satırları sınır kabul edilir) ve yapılandırılmış
 * madde listesinden bölme.
 * <p>
 * Var olan dosyanın üzerine yazılmaz; çakışma ve yazma hataları
 * sonuçtaki başarısız dosya adları listesine eklenir, işlem devam eder.
 * Ek sayacı durumu çağırandan ({@link FilenameSuffixState}) gelir.
 */
@Component
public class ArticleSplitter {

    private static final Logger log = LoggerFactory.getLogger(ArticleSplitter.class);

    /** Madde başlık satırı: {@code **[[Art. 40b CO]]**} */
    static final Pattern HEADER = Pattern.compile("^\\*\\*\\[\\[(.+?)]]\\*\\*[ \\t]*$", Pattern.MULTILINE);

    /** Başlıktaki numara parçası: 40b, 12_1, 5bis, 7quater ... */
    static final Pattern NUMBER_TOKEN = Pattern.compile("\\d+[a-z]?(?:_\\d+)?(?:quater|ter|bis)?[a-z]*");

    private final MarkdownRenderer renderer;
    private final LawmdMetrics metrics;

    public ArticleSplitter(MarkdownRenderer renderer, LawmdMetrics metrics) {
        this.renderer = renderer;
        this.metrics = metrics;
    }

    /**
     * Markdown metnini başlık satırlarından böler. Her blok bir sonraki başlığa
     * ya da metnin sonuna kadar sürer. Numarası okunamayan başlıklar atlanır.
     */
    public SplitResult split(String markdown, Path outputDirectory, String filenamePattern,
                             ConverterOptions options, FilenameSuffixState suffixState) {
        var blocks = new ArrayList<Block>();
        Matcher matcher = HEADER.matcher(markdown == null ? "" : markdown);
        int previousStart = -1;
        String previousTitle = null;
        while (matcher.find()) {
            if (previousTitle != null) {
                blocks.add(new Block(previousTitle, markdown.substring(previousStart, matcher.start())));
            }
            previousStart = matcher.start();
            previousTitle = matcher.group(1);
        }
        if (previousTitle != null) {
            blocks.add(new Block(previousTitle, markdown.substring(previousStart)));
        }
        return write(blocks, outputDirectory, filenamePattern, options, suffixState);
    }

    /**
     * Yapılandırılmış madde listesinden böler; her madde önce Markdown bloğuna çevrilir.
     */
    public SplitResult split(List<Article> articles, Path outputDirectory, String filenamePattern,
                             ConverterOptions options, FilenameSuffixState suffixState) {
        var blocks = new ArrayList<Block>(articles.size());
        for (Article article : articles) {
            blocks.add(new Block(renderer.headerTitle(article, options), renderer.render(article, options)));
        }
        return write(blocks, outputDirectory, filenamePattern, options, suffixState);
    }

    private SplitResult write(List<Block> blocks, Path outputDirectory, String filenamePattern,
                              ConverterOptions options, FilenameSuffixState suffixState) {
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            // dizin yoksa her dosya yazımı ayrıca başarısız olarak raporlanır
            log.warn("Çıktı dizini oluşturulamadı: {}: {}", outputDirectory, e.getMessage());
        }

        int saved = 0;
        var failed = new ArrayList<String>();

        for (Block block : blocks) {
            String content = block.content().strip();
            if (content.isEmpty()) {
                continue;
            }
            Matcher token = NUMBER_TOKEN.matcher(block.title());
            if (!token.find()) {
                log.debug("Numarasız madde başlığı atlandı: {}", block.title());
                continue;
            }
            String originalNumber = token.group();
            String prefix = block.title().substring(0, token.start()).strip();
            String filename = filename(filenamePattern, suffixState.filenameNumber(originalNumber),
                    prefix, options.getCodeName());

            try {
                Path target = outputDirectory.resolve(filename);
                if (!isDirectChild(outputDirectory, target)) {
                    log.warn("Dosya adı çıktı dizininin dışına işaret ediyor, atlandı: {}", filename);
                    failed.add(filename);
                    metrics.recordSplitFile("failed");
                    continue;
                }
                if (Files.exists(target)) {
                    log.warn("Dosya zaten mevcut, atlandı: {}", target);
                    failed.add(filename);
                    metrics.recordSplitFile("failed");
                    continue;
                }
                Files.writeString(target, content, options.getOutputEncoding(),
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                saved++;
                suffixState.advance(originalNumber);
                metrics.recordSplitFile("saved");
            } catch (IOException | InvalidPathException e) {
                log.warn("Madde dosyası yazılamadı: {}: {}", filename, e.getMessage());
                failed.add(filename);
                metrics.recordSplitFile("failed");
            }
        }

        log.info("Bölme tamamlandı: {} dosya yazıldı, {} başarısız, dizin: {}",
                saved, failed.size(), outputDirectory);
        return new SplitResult(saved, failed, outputDirectory);
    }

    /**
     * Dosya adı yer tutucularla birleştirildikten sonra çıktı dizininin doğrudan
     * altında kalmalı; mutlak yol, ayırıcı veya {@code ..} içeren adlar reddedilir.
     */
    static boolean isDirectChild(Path outputDirectory, Path target) {
        Path directory = outputDirectory.toAbsolutePath().normalize();
        Path normalized = target.toAbsolutePath().normalize();
        return directory.equals(normalized.getParent())
                && normalized.getFileName().equals(target.getFileName());
    }

    static String filename(String pattern, String number, String prefix, String codeName) {
        return pattern
                .replace("{num}", number)
                .replace("{prefix}", prefix)
                .replace("{code}", codeName)
                + ".md";
    }

    private record Block(String title, String content) {
    }
}
