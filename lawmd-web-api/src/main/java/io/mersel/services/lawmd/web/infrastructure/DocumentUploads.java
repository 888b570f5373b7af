package io.mersel.services.lawmd.web.infrastructure;

import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Yüklenen XML belgesinin boyut kontrolü ve okunması.
 */
public final class DocumentUploads {

    private DocumentUploads() {
    }

    /**
     * @throws IllegalArgumentException Belge boş veya izin verilen boyuttan büyük
     */
    public static byte[] read(MultipartFile document, int maxDocumentSizeMb) throws IOException {
        if (document == null || document.isEmpty()) {
            throw new IllegalArgumentException("XML belgesi boş olamaz");
        }
        if (document.getSize() > maxDocumentSizeMb * 1024L * 1024L) {
            throw new IllegalArgumentException(
                    "Belge boyutu çok büyük: " + (document.getSize() / (1024 * 1024))
                            + " MB. Maksimum izin verilen: " + maxDocumentSizeMb + " MB");
        }
        return document.getBytes();
    }
}
