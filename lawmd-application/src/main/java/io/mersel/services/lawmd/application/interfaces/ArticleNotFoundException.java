package io.mersel.services.lawmd.application.interfaces;

/**
 * Tek madde dışa aktarımında istenen madde numarası belgede yok.
 */
public class ArticleNotFoundException extends ConversionException {

    private final String articleNumber;

    public ArticleNotFoundException(String articleNumber) {
        super("Madde bulunamadı: " + articleNumber);
        this.articleNumber = articleNumber;
    }

    public String getArticleNumber() {
        return articleNumber;
    }
}
