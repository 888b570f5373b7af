package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.application.models.ConverterOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * BreadcrumbResolver birim testleri.
 * <p>
 * Başlık sırasını, not içeriğinin dışlanmasını ve son hükümler bayrağının
 * çağrı içindeki yapışkanlığını doğrular.
 */
@DisplayName("BreadcrumbResolver")
class BreadcrumbResolverTest {

    private final BreadcrumbResolver resolver = new BreadcrumbResolver(new InlineTextCollector());

    @Test
    @DisplayName("Başlıklar kökten maddeye doğru sıralanmalı")
    void shouldOrderHeadingsRootFirst() throws Exception {
        var article = AknFixtures.firstArticle("""
                <level><num>Titre premier</num><heading>Des obligations</heading>
                  <level><heading>Chapitre 2</heading>
                    <article><num>Art. 40b</num></article>
                  </level>
                </level>
                """);
        var context = new ConversionContext(ConverterOptions.defaults());

        assertThat(resolver.resolve(article, context))
                .containsExactly("Des obligations", "Chapitre 2");
        assertThat(context.isFinalSection()).isFalse();
    }

    @Test
    @DisplayName("level dışındaki madde için boş iz")
    void shouldReturnEmptyWithoutLevels() throws Exception {
        var article = AknFixtures.firstArticle("<article><num>Art. 1</num></article>");

        assertThat(resolver.resolve(article, new ConversionContext(ConverterOptions.defaults()))).isEmpty();
    }

    @Test
    @DisplayName("Başlıktaki yazar notu metni ize girmemeli")
    void shouldExcludeAuthorialNotes() throws Exception {
        var article = AknFixtures.firstArticle("""
                <level><heading>Chapitre 3<authorialNote><p>Eingefügt durch Ziff. I</p></authorialNote></heading>
                  <article><num>Art. 5</num></article>
                </level>
                """);
        var context = new ConversionContext(ConverterOptions.defaults());

        assertThat(resolver.resolve(article, context)).containsExactly("Chapitre 3");
        assertThat(context.articleNotes()).isEmpty();
    }

    @Test
    @DisplayName("Son hükümler başlığı bayrağı set etmeli ve bayrak sonraki maddelerde kalmalı")
    void shouldSetStickyFinalSectionFlag() throws Exception {
        var articles = AknFixtures.articles("""
                <level><heading>Titre premier</heading>
                  <article><num>Art. 1</num></article>
                </level>
                <level><heading>Titre final: Application</heading>
                  <article><num>Art. 2</num></article>
                </level>
                <level><heading>Annexe</heading>
                  <article><num>Art. 3</num></article>
                </level>
                """);
        var context = new ConversionContext(ConverterOptions.defaults());

        resolver.resolve(articles.get(0), context);
        assertThat(context.isFinalSection()).isFalse();

        resolver.resolve(articles.get(1), context);
        assertThat(context.isFinalSection()).isTrue();

        assertThat(resolver.resolve(articles.get(2), context)).containsExactly("Annexe");
        assertThat(context.isFinalSection()).isTrue();
    }

    @Test
    @DisplayName("Yapılandırılmış anahtar kelimeler kullanılmalı")
    void shouldUseConfiguredKeywords() throws Exception {
        var article = AknFixtures.firstArticle("""
                <level><heading>Schlussbestimmungen</heading>
                  <article><num>Art. 9</num></article>
                </level>
                """);
        var options = ConverterOptions.builder().finalSectionKeywords(List.of("Anhang")).build();
        var context = new ConversionContext(options);

        resolver.resolve(article, context);

        assertThat(context.isFinalSection()).isFalse();
    }
}
