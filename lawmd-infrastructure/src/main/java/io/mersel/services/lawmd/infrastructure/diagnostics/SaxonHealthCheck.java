package io.mersel.services.lawmd.infrastructure.diagnostics;

import io.mersel.services.lawmd.infrastructure.AknDocumentLoader;
import io.mersel.services.lawmd.infrastructure.akn.AknNames;
import io.mersel.services.lawmd.infrastructure.akn.AknNodes;
import net.sf.saxon.s9api.XdmNode;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Saxon HE motoru sağlık kontrolü.
 * <p>
 * Saxon motorunun çalışır durumda olduğunu küçük bir Akoma Ntoso belgesini
 * yükleyip içindeki maddeyi bularak doğrular.
 */
@Component
public class SaxonHealthCheck implements HealthIndicator {

    private static final byte[] TEST_DOCUMENT = """
            <?xml version="1.0" encoding="UTF-8"?>
            <akomaNtoso xmlns="http://docs.oasis-open.org/legaldocml/ns/akn/3.0">
                <act><body>
                    <article><num>Art. 1</num></article>
                </body></act>
            </akomaNtoso>""".getBytes(StandardCharsets.UTF_8);

    /** Tekrar tekrar oluşturmamak için sınıf seviyesinde tutulan yükleyici */
    private final AknDocumentLoader loader = new AknDocumentLoader();

    @Override
    public Health health() {
        try {
            XdmNode document = loader.load(TEST_DOCUMENT);
            int articles = AknNodes.descendants(document, AknNames.ARTICLE).size();
            if (articles != 1) {
                return Health.down()
                        .withDetail("engine", "Saxon HE")
                        .withDetail("error", "Test belgesinde madde bulunamadı")
                        .build();
            }

            return Health.up()
                    .withDetail("engine", "Saxon HE")
                    .withDetail("version", net.sf.saxon.Version.getProductVersion())
                    .withDetail("namespace", AknNames.NS_AKN)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("engine", "Saxon HE")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
