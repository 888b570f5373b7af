package io.mersel.services.lawmd.application.interfaces;

import io.mersel.services.lawmd.application.models.ConvertedDocument;
import io.mersel.services.lawmd.application.models.SplitResult;

import java.nio.file.Path;

/**
 * Birleştirilmiş belgeyi madde başına bir {@code .md} dosyasına böler.
 * <p>
 * Dosya adı çakışmaları ve yazma hataları istisna fırlatmaz;
 * {@link SplitResult#failedFilenames()} içinde raporlanır.
 * <p>
 * Dosya adı kalıbında {@code {num}}, {@code {prefix}} ve {@code {code}}
 * yer tutucuları desteklenir; {@code .md} uzantısı otomatik eklenir.
 */
public interface IArticleSplitter {

    /**
     * Önceden üretilmiş Markdown metnini madde başlıklarından bölerek yazar.
     */
    SplitResult split(String markdown, Path outputDirectory, String filenamePattern);

    /**
     * Yapılandırılmış madde listesinden doğrudan bölerek yazar.
     */
    SplitResult split(ConvertedDocument document, Path outputDirectory, String filenamePattern);
}
