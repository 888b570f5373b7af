package io.mersel.services.lawmd.infrastructure.diagnostics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Dönüşüm servisi özel metrikleri.
 * <p>
 * Prometheus üzerinden dışa aktarılan tüm uygulama metriklerini yönetir.
 */
@Component
public class LawmdMetrics {

    private final MeterRegistry registry;

    public LawmdMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Dönüşüm metrikleri kaydet.
     *
     * @param result       "success", "parse_failed" veya "no_articles"
     * @param articleCount Çıkarılan madde sayısı
     * @param durationMs   İşlem süresi (milisaniye)
     * @param outputBytes  Markdown çıktı boyutu (byte)
     */
    public void recordConversion(String result, int articleCount, long durationMs, int outputBytes) {
        Counter.builder("lawmd_conversions_total")
                .tag("result", result)
                .description("Toplam dönüşüm sayısı")
                .register(registry)
                .increment();

        Timer.builder("lawmd_conversion_duration")
                .tag("result", result)
                .description("Dönüşüm süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));

        if (articleCount > 0) {
            registry.summary("lawmd_conversion_articles").record(articleCount);
            registry.summary("lawmd_conversion_output_bytes").record(outputBytes);
        }
    }

    /**
     * Bölme sırasında dosya bazlı sonuç kaydet.
     *
     * @param result "saved" veya "failed"
     */
    public void recordSplitFile(String result) {
        Counter.builder("lawmd_split_files_total")
                .tag("result", result)
                .description("Bölme ile yazılan/yazılamayan dosya sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Rate limit aşımı metrikleri kaydet.
     *
     * @param endpoint "convert" veya "split"
     */
    public void recordRateLimitExceeded(String endpoint) {
        Counter.builder("lawmd_rate_limit_exceeded_total")
                .tag("endpoint", endpoint)
                .description("Rate limit aşım sayısı")
                .register(registry)
                .increment();
    }
}
