package com.tribunal.records.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the case records module.
 */
@Component
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class CaseRecordsProperties {

    private Pagination pagination = new Pagination();

    @Getter
    @Setter
    public static class Pagination {
        /**
         * Page size used when a listing asks for a page without a limit.
         */
        private int defaultLimit = 20;

        /**
         * Largest page size a caller may request.
         */
        private int maxLimit = 100;
    }
}
