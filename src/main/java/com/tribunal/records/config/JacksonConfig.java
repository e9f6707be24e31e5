package com.tribunal.records.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Customizes the ObjectMapper Spring Boot builds: ISO dates, unknown request
 * properties ignored, null envelope fields left out.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @ConditionalOnMissingBean(name = "caseRecordsJsonCustomizer")
    Jackson2ObjectMapperBuilderCustomizer caseRecordsJsonCustomizer() {
        return builder -> builder
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .serializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
