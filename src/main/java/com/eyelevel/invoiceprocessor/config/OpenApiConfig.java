package com.eyelevel.invoiceprocessor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Invoice Processor API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Accepts scanned invoices, hands them to the document-analysis provider and
                                tracks every document through its processing and review states.

                                * **Submission:** direct multipart uploads or presigned upload sessions.
                                * **Status:** single-document polling and bounded batch refresh.
                                * **Review:** verification, reversion and manual entry for failed analyses.
                                * **Recovery:** manual retry, file replacement, soft delete and restore.

                                Analysis results are reconciled by polling; there is no inbound webhook.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
