package io.mersel.services.lawmd.application.models;

import io.mersel.services.lawmd.application.enums.RenderMode;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Dönüştürücü ayarları.
 * <p>
 * Değişmez bir değer nesnesidir; bir dönüştürücü örneği ömrü boyunca
 * aynı ayarlarla çalışır. İstek bazlı değişiklikler için {@link #toBuilder()}.
 */
public final class ConverterOptions {

    /** Son/geçiş hükümleri bölgesini işaret eden başlık kelimeleri (FR, DE, IT). */
    public static final List<String> DEFAULT_FINAL_SECTION_KEYWORDS = List.of(
            "Titre final",
            "Dispositions finales",
            "Dispositions transitoires",
            "Schlusstitel",
            "Schlussbestimmungen",
            "Übergangsbestimmungen",
            "Titolo finale",
            "Disposizioni finali",
            "Disposizioni transitorie"
    );

    private final String articlePrefix;
    private final String supplementaryPrefix;
    private final String codeName;
    private final String breadcrumbSeparator;
    private final Charset outputEncoding;
    private final int initialSuffixCounter;
    private final RenderMode renderMode;
    private final List<String> finalSectionKeywords;

    private ConverterOptions(Builder builder) {
        this.articlePrefix = builder.articlePrefix;
        this.supplementaryPrefix = builder.supplementaryPrefix;
        this.codeName = builder.codeName;
        this.breadcrumbSeparator = builder.breadcrumbSeparator;
        this.outputEncoding = builder.outputEncoding;
        this.initialSuffixCounter = builder.initialSuffixCounter;
        this.renderMode = builder.renderMode;
        this.finalSectionKeywords = List.copyOf(builder.finalSectionKeywords);
    }

    public static ConverterOptions defaults() {
        return builder().build();
    }

    /** Madde başlığı öneki, ör. "Art.". */
    public String getArticlePrefix() {
        return articlePrefix;
    }

    /** Son hükümler bölgesindeki maddeler için önek, ör. "SupArt.". */
    public String getSupplementaryPrefix() {
        return supplementaryPrefix;
    }

    /** Kanun kısaltması, ör. "CO", "CC". */
    public String getCodeName() {
        return codeName;
    }

    public String getBreadcrumbSeparator() {
        return breadcrumbSeparator;
    }

    public Charset getOutputEncoding() {
        return outputEncoding;
    }

    /** Dosya adı ek sayacının başlangıç değeri (1 = temel). */
    public int getInitialSuffixCounter() {
        return initialSuffixCounter;
    }

    public RenderMode getRenderMode() {
        return renderMode;
    }

    public List<String> getFinalSectionKeywords() {
        return finalSectionKeywords;
    }

    public Builder toBuilder() {
        return new Builder()
                .articlePrefix(articlePrefix)
                .supplementaryPrefix(supplementaryPrefix)
                .codeName(codeName)
                .breadcrumbSeparator(breadcrumbSeparator)
                .outputEncoding(outputEncoding)
                .initialSuffixCounter(initialSuffixCounter)
                .renderMode(renderMode)
                .finalSectionKeywords(finalSectionKeywords);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String articlePrefix = "Art.";
        private String supplementaryPrefix = "SupArt.";
        private String codeName = "CO";
        private String breadcrumbSeparator = " << ";
        private Charset outputEncoding = StandardCharsets.UTF_8;
        private int initialSuffixCounter = 1;
        private RenderMode renderMode = RenderMode.WITH_NOTES;
        private List<String> finalSectionKeywords = DEFAULT_FINAL_SECTION_KEYWORDS;

        private Builder() {
        }

        public Builder articlePrefix(String articlePrefix) {
            this.articlePrefix = articlePrefix;
            return this;
        }

        public Builder supplementaryPrefix(String supplementaryPrefix) {
            this.supplementaryPrefix = supplementaryPrefix;
            return this;
        }

        public Builder codeName(String codeName) {
            this.codeName = codeName;
            return this;
        }

        public Builder breadcrumbSeparator(String breadcrumbSeparator) {
            this.breadcrumbSeparator = breadcrumbSeparator;
            return this;
        }

        public Builder outputEncoding(Charset outputEncoding) {
            this.outputEncoding = outputEncoding;
            return this;
        }

        public Builder initialSuffixCounter(int initialSuffixCounter) {
            this.initialSuffixCounter = initialSuffixCounter;
            return this;
        }

        public Builder renderMode(RenderMode renderMode) {
            this.renderMode = renderMode;
            return this;
        }

        public Builder finalSectionKeywords(List<String> finalSectionKeywords) {
            this.finalSectionKeywords = finalSectionKeywords;
            return this;
        }

        public ConverterOptions build() {
            if (articlePrefix == null || codeName == null || breadcrumbSeparator == null
                    || supplementaryPrefix == null) {
                throw new IllegalArgumentException("Önek, kanun adı ve ayırıcı null olamaz");
            }
            if (outputEncoding == null || renderMode == null || finalSectionKeywords == null) {
                throw new IllegalArgumentException("Kodlama, render modu ve anahtar kelimeler null olamaz");
            }
            if (initialSuffixCounter < 1) {
                throw new IllegalArgumentException(
                        "Ek sayacı 1 veya daha büyük olmalı (verilen: " + initialSuffixCounter + ")");
            }
            return new ConverterOptions(this);
        }
    }
}
