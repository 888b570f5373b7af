package io.mersel.services.lawmd.web.dto;

import io.mersel.services.lawmd.application.enums.RenderMode;
import io.mersel.services.lawmd.application.models.ConverterOptions;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.springframework.web.multipart.MultipartFile;

/**
 * Dönüşüm isteği DTO'su.
 * <p>
 * multipart/form-data olarak alınır. Boş bırakılan alanlarda
 * yapılandırmadaki değerler kullanılır.
 */
public class ConvertRequestDto {

    /** Dosya adlarına girdiği için dizin ayırıcı ve {@code ..} içeremez. */
    static final String FILENAME_SAFE = "^(?!.*\\.\\.)[^/\\\\]*$";

    @NotNull(message = "XML belgesi boş olamaz")
    @Schema(description = "Dönüştürülecek Akoma Ntoso (Fedlex) XML belgesi",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private MultipartFile document;

    @Size(max = 20)
    @Pattern(regexp = FILENAME_SAFE, message = "Önek dizin ayırıcı veya '..' içeremez")
    @Schema(description = "Madde başlığı öneki", example = "Art.", nullable = true)
    private String articlePrefix;

    @Size(max = 40)
    @Pattern(regexp = FILENAME_SAFE, message = "Kanun adı dizin ayırıcı veya '..' içeremez")
    @Schema(description = "Kanun kısaltması; başlıkta ve dosya adlarında kullanılır",
            example = "CO", nullable = true)
    private String codeName;

    @Size(max = 10)
    @Schema(description = "Kenar notu izi ayırıcısı", example = " << ", nullable = true)
    private String breadcrumbSeparator;

    @Schema(description = "Yazar notları işaret ve not bloğu ile basılsın mı",
            nullable = true, defaultValue = "true")
    private Boolean renderNotes;

    /**
     * İstekte verilen alanları yapılandırılmış ayarların üzerine uygular.
     */
    public ConverterOptions applyTo(ConverterOptions base) {
        var builder = base.toBuilder();
        if (articlePrefix != null && !articlePrefix.isBlank()) {
            builder.articlePrefix(articlePrefix.strip());
        }
        if (codeName != null && !codeName.isBlank()) {
            builder.codeName(codeName.strip());
        }
        if (breadcrumbSeparator != null && !breadcrumbSeparator.isEmpty()) {
            builder.breadcrumbSeparator(breadcrumbSeparator);
        }
        if (renderNotes != null) {
            builder.renderMode(renderNotes ? RenderMode.WITH_NOTES : RenderMode.WITHOUT_NOTES);
        }
        return builder.build();
    }

    public MultipartFile getDocument() {
        return document;
    }

    public void setDocument(MultipartFile document) {
        this.document = document;
    }

    public String getArticlePrefix() {
        return articlePrefix;
    }

    public void setArticlePrefix(String articlePrefix) {
        this.articlePrefix = articlePrefix;
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

    public Boolean getRenderNotes() {
        return renderNotes;
    }

    public void setRenderNotes(Boolean renderNotes) {
        this.renderNotes = renderNotes;
    }
}
