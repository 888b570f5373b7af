package io.mersel.services.lawmd.web;

import io.mersel.services.lawmd.infrastructure.config.InfrastructureConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * MERSEL Law Markdown Service - Ana uygulama giriş noktası.
 * <p>
 * Saxon HE motoru ile Akoma Ntoso (Fedlex) mevzuat XML'lerini Markdown'a
 * dönüştürme ve madde bazlı dosyalara bölme servisi.
 */
@SpringBootApplication
@Import(InfrastructureConfig.class)
public class LawMarkdownServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LawMarkdownServiceApplication.class, args);
    }
}
