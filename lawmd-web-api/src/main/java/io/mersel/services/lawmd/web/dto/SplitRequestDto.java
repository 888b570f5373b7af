package io.mersel.services.lawmd.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Madde bazlı bölme isteği.
 * <p>
 * Hedef dizin sunucudaki çıktı köküne göreli verilir ({@code lawmd.split.output-root}).
 */
public class SplitRequestDto extends ConvertRequestDto {

    public static final String DEFAULT_FILENAME_PATTERN = "{prefix} {num} {code}";

    @NotBlank(message = "Hedef dizin boş olamaz")
    @Size(max = 255)
    @Schema(description = "Çıktı köküne göreli hedef dizin", example = "co-2024",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private String targetDirectory;

    @Size(max = 200)
    @Schema(description = "Dosya adı kalıbı; {num}, {prefix}, {code} yer tutucuları desteklenir, .md eklenir",
            example = DEFAULT_FILENAME_PATTERN, defaultValue = DEFAULT_FILENAME_PATTERN)
    private String filenamePattern = DEFAULT_FILENAME_PATTERN;

    @Min(value = 1, message = "Ek sayacı 1 veya daha büyük olmalı")
    @Schema(description = "Dosya adı ek sayacının başlangıç değeri (1 = temel, 2 = bis, 3 = ter)",
            nullable = true)
    private Integer initialSuffixCounter;

    public String getTargetDirectory() {
        return targetDirectory;
    }

    public void setTargetDirectory(String targetDirectory) {
        this.targetDirectory = targetDirectory;
    }

    public String getFilenamePattern() {
        return filenamePattern;
    }

    public void setFilenamePattern(String filenamePattern) {
        this.filenamePattern = filenamePattern;
    }

    public Integer getInitialSuffixCounter() {
        return initialSuffixCounter;
    }

    public void setInitialSuffixCounter(Integer initialSuffixCounter) {
        this.initialSuffixCounter = initialSuffixCounter;
    }
}
