package io.mersel.services.lawmd.application.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * İsviçre mevzuat yazımındaki Latince sıra ekleri (bis, ter, quater, ...).
 * <p>
 * Aynı temel numarayı paylaşan sonradan eklenmiş hükümleri ayırt etmek için
 * kullanılır: ikinci tekrar {@code bis}, üçüncü {@code ter} vb.
 * On ikinciden sonrası için kelime yoktur, sayının kendisi kullanılır.
 */
public enum OrdinalWord {
    BIS(2, "bis"),
    TER(3, "ter"),
    QUATER(4, "quater"),
    QUINQUIES(5, "quinquies"),
    SEXIES(6, "sexies"),
    SEPTIES(7, "septies"),
    OCTIES(8, "octies"),
    NONIES(9, "nonies"),
    DECIES(10, "decies"),
    UNDECIES(11, "undecies"),
    DUODECIES(12, "duodecies");

    private final int occurrence;
    private final String word;

    OrdinalWord(int occurrence, String word) {
        this.occurrence = occurrence;
        this.word = word;
    }

    public int getOccurrence() {
        return occurrence;
    }

    public String getWord() {
        return word;
    }

    /**
     * Verilen tekrar sırası için ek kelimesini döner.
     *
     * @param occurrence 2 ve üzeri tekrar sırası
     * @return {@code bis}, {@code ter}, ... ya da 12'den büyükse sayının kendisi
     */
    public static String suffixFor(int occurrence) {
        return Arrays.stream(values())
                .filter(o -> o.occurrence == occurrence)
                .map(OrdinalWord::getWord)
                .findFirst()
                .orElse(String.valueOf(occurrence));
    }

    /**
     * Dosya adı üretiminde tanınan ekler: quater, ter, bis.
     * <p>
     * {@code quater} kelimesi {@code ter} içerdiğinden önce o kontrol edilir.
     */
    public static Optional<OrdinalWord> detectFilenameSuffix(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String lower = token.toLowerCase();
        if (lower.contains(QUATER.word)) {
            return Optional.of(QUATER);
        }
        if (lower.contains(TER.word)) {
            return Optional.of(TER);
        }
        if (lower.contains(BIS.word)) {
            return Optional.of(BIS);
        }
        return Optional.empty();
    }
}
