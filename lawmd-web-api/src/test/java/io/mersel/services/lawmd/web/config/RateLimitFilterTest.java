package io.mersel.services.lawmd.web.config;

import io.mersel.services.lawmd.infrastructure.diagnostics.LawmdMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RateLimitFilter birim testleri.
 */
@DisplayName("RateLimitFilter")
class RateLimitFilterTest {

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    private static MockHttpServletResponse call(RateLimitConfig.RateLimitFilter filter, String uri,
                                                String remoteAddr, String forwardedFor) throws Exception {
        var request = new MockHttpServletRequest("POST", uri);
        request.setRemoteAddr(remoteAddr);
        if (forwardedFor != null) {
            request.addHeader("X-Forwarded-For", forwardedFor);
        }
        var response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }

    @Test
    @DisplayName("Limit aşıldığında 429 dönmeli ve metrik kaydedilmeli")
    void shouldRejectAfterLimit() throws Exception {
        var filter = new RateLimitConfig.RateLimitFilter(true, 2, 1, false, new LawmdMetrics(registry));

        assertThat(call(filter, "/v1/convert", "10.0.0.1", null).getStatus()).isEqualTo(200);
        var second = call(filter, "/v1/convert/article", "10.0.0.1", null);
        assertThat(second.getStatus()).isEqualTo(200);
        assertThat(second.getHeader("X-RateLimit-Remaining")).isEqualTo("0");

        var third = call(filter, "/v1/convert", "10.0.0.1", null);

        assertThat(third.getStatus()).isEqualTo(429);
        assertThat(third.getContentAsString()).contains("Rate limit exceeded");
        assertThat(registry.get("lawmd_rate_limit_exceeded_total").tag("endpoint", "convert").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Bölme ve dönüşüm limitleri ayrı sayılmalı")
    void shouldCountEndpointsSeparately() throws Exception {
        var filter = new RateLimitConfig.RateLimitFilter(true, 1, 1, false, new LawmdMetrics(registry));

        assertThat(call(filter, "/v1/convert", "10.0.0.1", null).getStatus()).isEqualTo(200);
        assertThat(call(filter, "/v1/split", "10.0.0.1", null).getStatus()).isEqualTo(200);
        assertThat(call(filter, "/v1/split", "10.0.0.1", null).getStatus()).isEqualTo(429);
        assertThat(registry.get("lawmd_rate_limit_exceeded_total").tag("endpoint", "split").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Proxy modu kapalıyken X-Forwarded-For yok sayılmalı")
    void shouldIgnoreForwardedForWithoutProxyMode() throws Exception {
        var filter = new RateLimitConfig.RateLimitFilter(true, 1, 1, false, new LawmdMetrics(registry));

        call(filter, "/v1/convert", "10.0.0.1", "1.1.1.1");

        assertThat(call(filter, "/v1/convert", "10.0.0.1", "2.2.2.2").getStatus()).isEqualTo(429);
    }

    @Test
    @DisplayName("Proxy modunda istemci X-Forwarded-For ilk IP'si ile ayırt edilmeli")
    void shouldUseForwardedForInProxyMode() throws Exception {
        var filter = new RateLimitConfig.RateLimitFilter(true, 1, 1, true, new LawmdMetrics(registry));

        call(filter, "/v1/convert", "10.0.0.1", "1.1.1.1, 10.0.0.1");

        assertThat(call(filter, "/v1/convert", "10.0.0.1", "2.2.2.2").getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("Devre dışıyken tüm istekler geçmeli")
    void shouldPassWhenDisabled() throws Exception {
        var filter = new RateLimitConfig.RateLimitFilter(false, 1, 1, false, new LawmdMetrics(registry));

        call(filter, "/v1/convert", "10.0.0.1", null);

        assertThat(call(filter, "/v1/convert", "10.0.0.1", null).getStatus()).isEqualTo(200);
    }
}
