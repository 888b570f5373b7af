package io.mersel.services.lawmd.application.interfaces;

import io.mersel.services.lawmd.application.models.ConvertedDocument;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Akoma Ntoso (Fedlex) XML belgesini Markdown'a dönüştüren servis arayüzü.
 */
public interface ILawDocumentConverter {

    /**
     * XML dosyasını Markdown metnine dönüştürür.
     *
     * @param xmlFile Kaynak XML dosyası
     * @return Başlık, zaman damgası ve tüm maddeleri içeren Markdown
     * @throws DocumentParseException    XML okunamadı veya iyi biçimli değil
     * @throws MissingArticlesException Belgede hiç madde yok
     */
    String convert(Path xmlFile) throws DocumentParseException, MissingArticlesException;

    /**
     * XML dosyasını dönüştürür ve sonucu {@code outputFile}'a yazar.
     *
     * @return Yazılan Markdown metni
     * @throws IOException Çıktı dosyası yazılamadı
     */
    String convert(Path xmlFile, Path outputFile)
            throws DocumentParseException, MissingArticlesException, IOException;

    /**
     * Bellekteki XML içeriğini dönüştürür; yapılandırılmış madde listesi de döner.
     */
    ConvertedDocument convertDocument(byte[] xmlContent)
            throws DocumentParseException, MissingArticlesException;

    /**
     * Dönüştürülmüş belgeden tek bir maddenin Markdown bloğunu üretir.
     *
     * @param articleNumber Madde numarası (ör. "40b")
     * @throws ArticleNotFoundException Bu numarada madde yok
     */
    String renderArticle(ConvertedDocument document, String articleNumber) throws ArticleNotFoundException;
}
