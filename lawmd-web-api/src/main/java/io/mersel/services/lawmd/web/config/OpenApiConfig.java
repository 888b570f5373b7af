package io.mersel.services.lawmd.web.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI dokümantasyon yapılandırması.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI lawmdServiceOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("MERSEL Law Markdown Service API")
                        .description("""
                                İsviçre federal mevzuatının (Fedlex) Akoma Ntoso XML belgelerini Markdown'a dönüştürme servisi.

                                ## Özellikler
                                - **Tam Belge Dönüşümü**: madde başlıkları, bölüm izi, girintili fıkra/bent satırları
                                - **Yazar Notları**: numaralı işaretler ve madde sonu not bloğu (isteğe bağlı)
                                - **Tek Madde Dışa Aktarımı**: numarası verilen maddenin Markdown bloğu
                                - **Madde Bazlı Bölme**: her madde için ayrı `.md` dosyası, bis/ter/quater ekli adlandırma
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT")
                                .url("https://github.com/mersel-os/lawmd-service/blob/main/LICENSE"))
                        .contact(new Contact()
                                .name("Mersel")
                                .url("https://mersel.io")))
                .servers(List.of(
                        new Server().url("/").description("Yerel sunucu")
                ));
    }
}
