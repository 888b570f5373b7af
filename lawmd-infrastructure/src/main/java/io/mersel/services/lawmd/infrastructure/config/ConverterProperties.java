package io.mersel.services.lawmd.infrastructure.config;

import io.mersel.services.lawmd.application.enums.RenderMode;
import io.mersel.services.lawmd.application.models.ConverterOptions;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Dönüştürücü yapılandırma özellikleri.
 * <p>
 * {@code lawmd.converter} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code article-prefix}: madde başlığı öneki (varsayılan: {@code Art.})</li>
 *   <li>{@code supplementary-prefix}: son hükümler bölgesindeki maddelerin öneki (varsayılan: {@code SupArt.})</li>
 *   <li>{@code code-name}: kanun kısaltması, başlıkta ve dosya adlarında kullanılır (varsayılan: {@code CO})</li>
 *   <li>{@code breadcrumb-separator}: kenar notu izi ayırıcısı (varsayılan: {@code " << "})</li>
 *   <li>{@code output-encoding}: dosyaya yazarken kullanılan karakter kodlaması</li>
 *   <li>{@code suffix-counter}: dosya adı ek sayacının başlangıç değeri (1 veya büyük)</li>
 *   <li>{@code render-notes}: yazar notları işaret ve not bloğu ile basılsın mı</li>
 *   <li>{@code final-section-keywords}: son/geçiş hükümleri başlık kelimeleri</li>
 * </ul>
 * Geçersiz değerler başlangıçta uyarı ile varsayılana döndürülür.
 */
@ConfigurationProperties(prefix = "lawmd.converter")
public class ConverterProperties {

    private static final Logger log = LoggerFactory.getLogger(ConverterProperties.class);

    private String articlePrefix = "Art.";
    private String supplementaryPrefix = "SupArt.";
    private String codeName = "CO";
    private String breadcrumbSeparator = " << ";
    private String outputEncoding = StandardCharsets.UTF_8.name();
    private int suffixCounter = 1;
    private boolean renderNotes = true;
    private List<String> finalSectionKeywords = new ArrayList<>(ConverterOptions.DEFAULT_FINAL_SECTION_KEYWORDS);

    @PostConstruct
    void validate() {
        if (articlePrefix == null || articlePrefix.isBlank()) {
            log.warn("article-prefix boş olamaz, varsayılan 'Art.' kullanılıyor");
            articlePrefix = "Art.";
        }
        if (supplementaryPrefix == null || supplementaryPrefix.isBlank()) {
            log.warn("supplementary-prefix boş olamaz, varsayılan 'SupArt.' kullanılıyor");
            supplementaryPrefix = "SupArt.";
        }
        if (codeName == null || codeName.isBlank()) {
            log.warn("code-name boş olamaz, varsayılan 'CO' kullanılıyor");
            codeName = "CO";
        }
        if (breadcrumbSeparator == null || breadcrumbSeparator.isEmpty()) {
            log.warn("breadcrumb-separator boş olamaz, varsayılan ' << ' kullanılıyor");
            breadcrumbSeparator = " << ";
        }
        if (outputEncoding == null || !Charset.isSupported(outputEncoding)) {
            log.warn("output-encoding desteklenmiyor (verilen: {}), varsayılan UTF-8 kullanılıyor", outputEncoding);
            outputEncoding = StandardCharsets.UTF_8.name();
        }
        if (suffixCounter < 1) {
            log.warn("suffix-counter 1 veya daha büyük olmalı (verilen: {}), varsayılan 1 kullanılıyor", suffixCounter);
            suffixCounter = 1;
        }
        if (finalSectionKeywords == null) {
            finalSectionKeywords = new ArrayList<>(ConverterOptions.DEFAULT_FINAL_SECTION_KEYWORDS);
        }
        finalSectionKeywords.removeIf(k -> k == null || k.isBlank());
    }

    /**
     * Yapılandırmadan değişmez dönüştürücü ayarlarını üretir.
     */
    public ConverterOptions toOptions() {
        return ConverterOptions.builder()
                .articlePrefix(articlePrefix)
                .supplementaryPrefix(supplementaryPrefix)
                .codeName(codeName)
                .breadcrumbSeparator(breadcrumbSeparator)
                .outputEncoding(Charset.forName(outputEncoding))
                .initialSuffixCounter(suffixCounter)
                .renderMode(renderNotes ? RenderMode.WITH_NOTES : RenderMode.WITHOUT_NOTES)
                .finalSectionKeywords(finalSectionKeywords)
                .build();
    }

    public String getArticlePrefix() {
        return articlePrefix;
    }

    public void setArticlePrefix(String articlePrefix) {
        this.articlePrefix = articlePrefix;
    }

    public String getSupplementaryPrefix() {
        return supplementaryPrefix;
    }

    public void setSupplementaryPrefix(String supplementaryPrefix) {
        this.supplementaryPrefix = supplementaryPrefix;
    }

    public String getCodeName() {
        return codeName;
    }

    public void setCodeName(String codeName) {
        this.codeName = codeName;
    }

    public String getBreadcrumbSeparator() {
        return breadcrumbSeparator;
    }

    public void setBreadcrumbSeparator(String breadcrumbSeparator) {
        this.breadcrumbSeparator = breadcrumbSeparator;
    }

    public String getOutputEncoding() {
        return outputEncoding;
    }

    public void setOutputEncoding(String outputEncoding) {
        this.outputEncoding = outputEncoding;
    }

    public int getSuffixCounter() {
        return suffixCounter;
    }

    public void setSuffixCounter(int suffixCounter) {
        this.suffixCounter = suffixCounter;
    }

    public boolean isRenderNotes() {
        return renderNotes;
    }

    public void setRenderNotes(boolean renderNotes) {
        this.renderNotes = renderNotes;
    }

    public List<String> getFinalSectionKeywords() {
        return finalSectionKeywords;
    }

    public void setFinalSectionKeywords(List<String> finalSectionKeywords) {
        this.finalSectionKeywords = finalSectionKeywords;
    }
}
