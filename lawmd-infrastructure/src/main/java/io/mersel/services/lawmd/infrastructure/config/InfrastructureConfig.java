package io.mersel.services.lawmd.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Bu katmandaki tüm bileşenleri (Saxon yükleyici, çıkarıcılar, metrikler) otomatik tarar.
 * Dönüştürücü yapılandırma özelliklerini etkinleştirir.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.lawmd.infrastructure")
@EnableConfigurationProperties(ConverterProperties.class)
public class InfrastructureConfig {

    /** Belge zaman damgası için; testlerde sabit saat verilebilir. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
