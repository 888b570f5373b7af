package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.application.enums.OrdinalWord;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bölme sırasında dosya adlarına eklenen sıra eklerinin durum makinesi.
 * <p>
 * Sayaç: 1 = temel, 2 = bis, 3 = ter, 4 = quater. Yalnızca başarıyla
 * kaydedilen dosyalar sayacı ilerletir; aynı dönüştürücü örneğinin
 * ardışık bölme çağrıları arasında korunur.
 * <ul>
 *   <li>{@code bis} → {@code -2bis}</li>
 *   <li>{@code ter} → {@code -3ter}; sayaç 3 ise {@code -4quater}</li>
 *   <li>{@code quater} → {@code -4quater}</li>
 * </ul>
 * Thread-safe değildir.
 */
public final class FilenameSuffixState {

    private static final Pattern BASE_NUMBER = Pattern.compile("\\d+[a-z]?", Pattern.CASE_INSENSITIVE);

    private int counter;

    public FilenameSuffixState(int initialCounter) {
        if (initialCounter < 1) {
            throw new IllegalArgumentException("Ek sayacı 1 veya daha büyük olmalı (verilen: " + initialCounter + ")");
        }
        this.counter = initialCounter;
    }

    public int counter() {
        return counter;
    }

    /**
     * Başlıktan okunan numara parçası için dosya adında kullanılacak numara.
     *
     * @param token Ör. "5", "5bis", "12a"
     * @return Ör. "5", "5-2bis"; temel numara bulunamazsa parça olduğu gibi
     */
    public String filenameNumber(String token) {
        Optional<OrdinalWord> word = OrdinalWord.detectFilenameSuffix(token);
        String base = baseNumber(token, word);
        if (base == null) {
            return token;
        }
        if (word.isEmpty()) {
            return base;
        }
        return switch (word.get()) {
            case BIS -> base + "-2bis";
            case TER -> counter == 3 ? base + "-4quater" : base + "-3ter";
            default -> base + "-4quater";
        };
    }

    /**
     * Dosya başarıyla kaydedildikten sonra çağrılır.
     */
    public void advance(String token) {
        Optional<OrdinalWord> word = OrdinalWord.detectFilenameSuffix(token);
        if (word.isEmpty()) {
            counter = 1;
            return;
        }
        counter = switch (word.get()) {
            case BIS -> 2;
            case TER -> counter == 2 ? 3 : counter == 3 ? 4 : 3;
            default -> 4;
        };
    }

    private static String baseNumber(String token, Optional<OrdinalWord> word) {
        String stripped = token;
        if (word.isPresent()) {
            int at = token.toLowerCase().indexOf(word.get().getWord());
            stripped = token.substring(0, at) + token.substring(at + word.get().getWord().length());
        }
        Matcher matcher = BASE_NUMBER.matcher(stripped);
        return matcher.lookingAt() ? matcher.group() : null;
    }
}
