package io.mersel.services.lawmd.web.controllers;

import io.mersel.services.lawmd.application.models.ConvertedDocument;
import io.mersel.services.lawmd.application.models.ConverterOptions;
import io.mersel.services.lawmd.application.models.SplitResult;
import io.mersel.services.lawmd.infrastructure.LawMarkdownConverter;
import io.mersel.services.lawmd.infrastructure.LawMarkdownConverterFactory;
import io.mersel.services.lawmd.web.infrastructure.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * SplitController birim testleri.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("POST /v1/split")
class SplitControllerTest {

    private static final String MARKDOWN = "# CO\n\n**[[Art. 1 CO]]**\n\nText.\n";

    private MockMvc mockMvc;

    @TempDir
    Path outputRoot;

    @Mock
    private LawMarkdownConverterFactory converterFactory;

    @Mock
    private LawMarkdownConverter converter;

    @InjectMocks
    private SplitController splitController;

    @BeforeEach
    void setUp() throws Exception {
        var sizeField = SplitController.class.getDeclaredField("maxDocumentSizeMb");
        sizeField.setAccessible(true);
        sizeField.setInt(splitController, 10);
        var rootField = SplitController.class.getDeclaredField("outputRoot");
        rootField.setAccessible(true);
        rootField.set(splitController, outputRoot.toString());

        mockMvc = MockMvcBuilders
                .standaloneSetup(splitController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static MockMultipartFile xml() {
        return new MockMultipartFile("document", "co.xml", "text/xml", "<akomaNtoso/>".getBytes());
    }

    private void stubConversion() throws Exception {
        when(converterFactory.defaultOptions()).thenReturn(ConverterOptions.defaults());
        when(converterFactory.create(any(ConverterOptions.class))).thenReturn(converter);
        when(converter.convertDocument(any())).thenReturn(
                new ConvertedDocument("CO", LocalDateTime.of(2024, 3, 1, 10, 15, 30), List.of(), MARKDOWN));
    }

    @Test
    @DisplayName("200 OK + kayıt sayısı, başarısız dosyalar ve çıktı dizini dönmeli")
    void shouldReturnSplitSummary() throws Exception {
        stubConversion();
        Path target = outputRoot.toAbsolutePath().normalize().resolve("co");
        when(converter.split(eq(MARKDOWN), eq(target), eq("{prefix} {num} {code}")))
                .thenReturn(new SplitResult(2, List.of("Art. 1 CO.md"), target));

        mockMvc.perform(multipart("/v1/split")
                        .file(xml())
                        .param("targetDirectory", "co"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.savedCount").value(2))
                .andExpect(jsonPath("$.failedFilenames[0]").value("Art. 1 CO.md"))
                .andExpect(jsonPath("$.outputDirectory").value(target.toString()));
    }

    @Test
    @DisplayName("Özel kalıp ve başlangıç ek sayacı dönüştürücüye iletilmeli")
    void shouldPassPatternAndSuffixCounter() throws Exception {
        stubConversion();
        when(converter.split(anyString(), any(Path.class), anyString()))
                .thenReturn(new SplitResult(1, List.of(), outputRoot));

        mockMvc.perform(multipart("/v1/split")
                        .file(xml())
                        .param("targetDirectory", "a/b")
                        .param("filenamePattern", "{code}_{num}")
                        .param("initialSuffixCounter", "2"))
                .andExpect(status().isOk());

        var optionsCaptor = ArgumentCaptor.forClass(ConverterOptions.class);
        verify(converterFactory).create(optionsCaptor.capture());
        assertThat(optionsCaptor.getValue().getInitialSuffixCounter()).isEqualTo(2);

        var pathCaptor = ArgumentCaptor.forClass(Path.class);
        verify(converter).split(eq(MARKDOWN), pathCaptor.capture(), eq("{code}_{num}"));
        assertThat(pathCaptor.getValue()).isEqualTo(outputRoot.toAbsolutePath().normalize().resolve("a/b"));
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"../escape", "a/../../escape", "."})
    @DisplayName("Çıktı kökü dışına çıkan hedef dizin 400 dönmeli")
    void shouldRejectTraversal(String targetDirectory) throws Exception {
        mockMvc.perform(multipart("/v1/split")
                        .file(xml())
                        .param("targetDirectory", targetDirectory))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://mersel.io/lawmd/errors/bad-request"));

        verifyNoInteractions(converterFactory);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"{code}", "sub/{num}", "..{num}"})
    @DisplayName("{num} içermeyen veya dizin ayırıcılı kalıp 400 dönmeli")
    void shouldRejectInvalidPattern(String pattern) throws Exception {
        mockMvc.perform(multipart("/v1/split")
                        .file(xml())
                        .param("targetDirectory", "co")
                        .param("filenamePattern", pattern))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(converterFactory);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"/tmp/outside/pwn", "..", "sub\\pwn"})
    @DisplayName("Dosya adına giren kanun adı dizin ayırıcı veya '..' içerirse 400 dönmeli")
    void shouldRejectPathLikeCodeName(String codeName) throws Exception {
        mockMvc.perform(multipart("/v1/split")
                        .file(xml())
                        .param("targetDirectory", "co")
                        .param("filenamePattern", "{code}{num}")
                        .param("codeName", codeName))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Doğrulama Hatası"));

        verifyNoInteractions(converterFactory);
    }

    @Test
    @DisplayName("Dosya adına giren önek dizin ayırıcı içerirse 400 dönmeli")
    void shouldRejectPathLikePrefix() throws Exception {
        mockMvc.perform(multipart("/v1/split")
                        .file(xml())
                        .param("targetDirectory", "co")
                        .param("articlePrefix", "../Art."))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("articlePrefix")));

        verifyNoInteractions(converterFactory);
    }

    @Test
    @DisplayName("Hedef dizin zorunlu")
    void shouldRequireTargetDirectory() throws Exception {
        mockMvc.perform(multipart("/v1/split").file(xml()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Doğrulama Hatası"));
    }

    @Test
    @DisplayName("Sıfır başlangıç sayacı doğrulama hatası vermeli")
    void shouldRejectZeroSuffixCounter() throws Exception {
        mockMvc.perform(multipart("/v1/split")
                        .file(xml())
                        .param("targetDirectory", "co")
                        .param("initialSuffixCounter", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Doğrulama Hatası"));
    }
}
