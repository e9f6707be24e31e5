package com.tribunal.records.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Value("${app.openapi.title:Case Records API}")
    private String title;

    @Value("${app.openapi.description:Catalogs and case associations for adolescent justice records}")
    private String description;

    @Value("${app.openapi.version:1.0.0}")
    private String version;

    @Value("${app.openapi.contact.name:Case Records Team}")
    private String contactName;

    @Value("${app.openapi.contact.email:}")
    private String contactEmail;

    @Value("${app.openapi.license.name:MIT}")
    private String licenseName;

    @Bean
    @ConditionalOnMissingBean(OpenAPI.class)
    public OpenAPI caseRecordsOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title(title)
                .description(description)
                .version(version)
                .contact(new Contact()
                    .name(contactName)
                    .email(contactEmail))
                .license(new License()
                    .name(licenseName)));
    }
}
