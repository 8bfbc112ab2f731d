package com.clapgrow.channels.whatsapp.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI whatsappWorkerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("WhatsApp Connection Worker API")
                        .description("Links WhatsApp accounts to channels, keeps their connections alive, " +
                                "records conversations and sends AI auto-replies.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("ClapGrow")
                                .email("support@clapgrow.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development Server")
                ));
    }
}
