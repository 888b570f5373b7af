package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.application.enums.RenderMode;
import io.mersel.services.lawmd.application.models.ConverterOptions;
import io.mersel.services.lawmd.infrastructure.config.ConverterProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ConverterProperties birim testleri.
 * <p>
 * @PostConstruct validate() metodunun geçersiz değerleri varsayılana
 * geri döndürdüğünü ve ayarların doğru üretildiğini test eder.
 */
@DisplayName("ConverterProperties")
class ConverterPropertiesTest {

    @Test
    @DisplayName("varsayilan_degerler: defaults map to default options")
    void varsayilan_degerler() {
        ConverterOptions options = new ConverterProperties().toOptions();

        assertThat(options.getArticlePrefix()).isEqualTo("Art.");
        assertThat(options.getSupplementaryPrefix()).isEqualTo("SupArt.");
        assertThat(options.getCodeName()).isEqualTo("CO");
        assertThat(options.getBreadcrumbSeparator()).isEqualTo(" << ");
        assertThat(options.getOutputEncoding()).isEqualTo(StandardCharsets.UTF_8);
        assertThat(options.getInitialSuffixCounter()).isEqualTo(1);
        assertThat(options.getRenderMode()).isEqualTo(RenderMode.WITH_NOTES);
        assertThat(options.getFinalSectionKeywords())
                .containsExactlyElementsOf(ConverterOptions.DEFAULT_FINAL_SECTION_KEYWORDS);
    }

    @Test
    @DisplayName("validate_gecerli_degerler: valid values unchanged")
    void validate_gecerli_degerler() throws Exception {
        var props = new ConverterProperties();
        props.setCodeName("CC");
        props.setOutputEncoding("ISO-8859-1");
        props.setSuffixCounter(3);
        props.setRenderNotes(false);

        invokeValidate(props);
        ConverterOptions options = props.toOptions();

        assertThat(options.getCodeName()).isEqualTo("CC");
        assertThat(options.getOutputEncoding()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(options.getInitialSuffixCounter()).isEqualTo(3);
        assertThat(options.getRenderMode()).isEqualTo(RenderMode.WITHOUT_NOTES);
    }

    @Test
    @DisplayName("validate_gecersiz_degerler: invalid values reset to defaults")
    void validate_gecersiz_degerler() throws Exception {
        var props = new ConverterProperties();
        props.setArticlePrefix(" ");
        props.setCodeName("");
        props.setOutputEncoding("NO-SUCH-CHARSET");
        props.setSuffixCounter(0);

        invokeValidate(props);

        assertThat(props.getArticlePrefix()).isEqualTo("Art.");
        assertThat(props.getCodeName()).isEqualTo("CO");
        assertThat(props.getOutputEncoding()).isEqualTo("UTF-8");
        assertThat(props.getSuffixCounter()).isEqualTo(1);
    }

    @Test
    @DisplayName("validate_bos_anahtar_kelimeler: blank keywords removed, null restores defaults")
    void validate_bos_anahtar_kelimeler() throws Exception {
        var props = new ConverterProperties();
        props.setFinalSectionKeywords(new ArrayList<>(Arrays.asList("Anhang", " ", null)));
        invokeValidate(props);
        assertThat(props.getFinalSectionKeywords()).containsExactly("Anhang");

        props.setFinalSectionKeywords(null);
        invokeValidate(props);
        assertThat(props.getFinalSectionKeywords())
                .containsExactlyElementsOf(ConverterOptions.DEFAULT_FINAL_SECTION_KEYWORDS);
    }

    private static void invokeValidate(ConverterProperties props) throws Exception {
        Method validate = ConverterProperties.class.getDeclaredMethod("validate");
        validate.setAccessible(true);
        validate.invoke(props);
    }
}
