package io.mersel.services.lawmd.web.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.mersel.services.lawmd.infrastructure.diagnostics.LawmdMetrics;
import io.mersel.services.lawmd.web.dto.ErrorResponse;
import io.mersel.services.lawmd.web.infrastructure.JsonResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dönüşüm ve bölme endpoint'leri için istemci başına dakikalık istek sınırı.
 * <p>
 * {@code /v1/convert*} ve {@code /v1/split} ayrı pencerelerde sayılır; bölme diske
 * yazdığından varsayılan sınırı daha düşüktür. {@code lawmd.rate-limit.behind-proxy}
 * açık değilse istemci yalnızca bağlantı adresinden tanınır.
 */
@Configuration
public class RateLimitConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimitConfig.class);

    @Value("${lawmd.rate-limit.enabled:${LAWMD_RATE_LIMIT_ENABLED:true}}")
    private boolean enabled;

    @Value("${lawmd.rate-limit.convert:${LAWMD_RATE_LIMIT_CONVERT:30}}")
    private int convertLimit;

    @Value("${lawmd.rate-limit.split:${LAWMD_RATE_LIMIT_SPLIT:10}}")
    private int splitLimit;

    @Value("${lawmd.rate-limit.behind-proxy:${LAWMD_RATE_LIMIT_BEHIND_PROXY:false}}")
    private boolean behindProxy;

    @Bean
    FilterRegistrationBean<RateLimitFilter> rateLimitFilter(LawmdMetrics lawmdMetrics) {
        var bean = new FilterRegistrationBean<>(
                new RateLimitFilter(enabled, convertLimit, splitLimit, behindProxy, lawmdMetrics));
        bean.addUrlPatterns("/v1/convert", "/v1/convert/article", "/v1/split");
        bean.setOrder(Ordered.HIGHEST_PRECEDENCE + 1);

        if (enabled) {
            log.info("İstek sınırı: dönüşüm {}/dk, bölme {}/dk, proxy header'ları {}",
                    convertLimit, splitLimit, behindProxy ? "okunuyor" : "yok sayılıyor");
        } else {
            log.info("İstek sınırı kapalı");
        }
        return bean;
    }

    /**
     * Her endpoint grubu için Caffeine ile tutulan bir dakikalık sayaç penceresi.
     * Sınır aşılınca 429 ve JSON hata gövdesi döner.
     */
    static class RateLimitFilter extends OncePerRequestFilter {

        private final boolean enabled;
        private final boolean behindProxy;
        private final LawmdMetrics lawmdMetrics;
        private final Window convert;
        private final Window split;

        RateLimitFilter(boolean enabled, int convertLimit, int splitLimit,
                        boolean behindProxy, LawmdMetrics lawmdMetrics) {
            this.enabled = enabled;
            this.behindProxy = behindProxy;
            this.lawmdMetrics = lawmdMetrics;
            this.convert = new Window("convert", convertLimit);
            this.split = new Window("split", splitLimit);
        }

        @Override
        protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                        FilterChain filterChain) throws ServletException, IOException {
            Optional<Window> window = enabled ? windowFor(request.getRequestURI()) : Optional.empty();
            if (window.isEmpty()) {
                filterChain.doFilter(request, response);
                return;
            }

            Window w = window.get();
            int used = w.hit(clientKey(request));
            response.setHeader("X-RateLimit-Limit", String.valueOf(w.limit));
            response.setHeader("X-RateLimit-Remaining", String.valueOf(Math.max(0, w.limit - used)));

            if (used > w.limit) {
                lawmdMetrics.recordRateLimitExceeded(w.endpoint);
                JsonResponseWriter.write(response, HttpStatus.TOO_MANY_REQUESTS.value(),
                        new ErrorResponse("Rate limit exceeded",
                                "Dakika başına maksimum " + w.limit + " istek. Lütfen bekleyin."));
                return;
            }
            filterChain.doFilter(request, response);
        }

        private Optional<Window> windowFor(String uri) {
            if (uri.startsWith("/v1/convert")) {
                return Optional.of(convert);
            }
            if (uri.startsWith("/v1/split")) {
                return Optional.of(split);
            }
            return Optional.empty();
        }

        /** Proxy modunda ilk X-Forwarded-For adresi, sonra X-Real-IP; aksi halde bağlantı adresi. */
        private String clientKey(HttpServletRequest request) {
            if (behindProxy) {
                String forwarded = request.getHeader("X-Forwarded-For");
                if (forwarded != null && !forwarded.isBlank()) {
                    return forwarded.split(",")[0].trim();
                }
                String realIp = request.getHeader("X-Real-IP");
                if (realIp != null && !realIp.isBlank()) {
                    return realIp.trim();
                }
            }
            return request.getRemoteAddr();
        }
    }

    private static final class Window {

        private final String endpoint;
        private final int limit;
        private final Cache<String, AtomicInteger> counts = Caffeine.newBuilder()
                .maximumSize(50_000)
                .expireAfterWrite(Duration.ofMinutes(1))
                .build();

        Window(String endpoint, int limit) {
            this.endpoint = endpoint;
            this.limit = limit;
        }

        int hit(String client) {
            return counts.get(client, k -> new AtomicInteger()).incrementAndGet();
        }
    }
}
