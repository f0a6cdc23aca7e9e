package com.baykanat.socialsync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI socialSyncOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Social Sync - Agent & Post Queue API")
                        .description("""
                                Proactive Instagram sync and outbound delivery service. Exposes the agent \
                                heartbeat ingest, the outbound post queue admin endpoints (status, dead \
                                letters, manual retry) and the UGC repost producer.\
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Burak Aykanat")
                                .email("burak.aykanat12@gmail.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
