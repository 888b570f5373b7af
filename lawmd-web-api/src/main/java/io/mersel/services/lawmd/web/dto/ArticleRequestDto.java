package io.mersel.services.lawmd.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Tek madde dışa aktarım isteği.
 */
public class ArticleRequestDto extends ConvertRequestDto {

    @NotBlank(message = "Madde numarası boş olamaz")
    @Size(max = 20)
    @Schema(description = "Madde numarası", example = "40b", requiredMode = Schema.RequiredMode.REQUIRED)
    private String articleNumber;

    public String getArticleNumber() {
        return articleNumber;
    }

    public void setArticleNumber(String articleNumber) {
        this.articleNumber = articleNumber;
    }
}
