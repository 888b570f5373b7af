package io.mersel.services.lawmd.infrastructure;

import io.mersel.services.lawmd.infrastructure.diagnostics.SaxonHealthCheck;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SaxonHealthCheck birim testleri.
 */
@DisplayName("SaxonHealthCheck")
class SaxonHealthCheckTest {

    @Test
    @DisplayName("Saxon HE sağlık kontrolü UP dönmeli")
    void shouldReturnUpWhenSaxonIsWorking() {
        var healthCheck = new SaxonHealthCheck();
        var health = healthCheck.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails().get("engine")).isEqualTo("Saxon HE");
        assertThat(health.getDetails()).containsKey("version");
        assertThat(health.getDetails().get("namespace"))
                .isEqualTo("http://docs.oasis-open.org/legaldocml/ns/akn/3.0");
    }
}
