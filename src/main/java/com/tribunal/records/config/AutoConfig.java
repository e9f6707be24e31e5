package com.tribunal.records.config;

import com.tribunal.records.core.association.AssociationConfig;
import com.tribunal.records.core.association.AssociationManager;
import com.tribunal.records.core.catalog.TableConfigRegistry;
import com.tribunal.records.core.jdbc.JdbcQueryExecutor;
import com.tribunal.records.core.jdbc.QueryExecutor;
import com.tribunal.records.util.InputSanitizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Auto-configuration class for the case records module.
 * Enables component scanning for the module's packages and provides the catalog
 * registry, the query executor and the association managers.
 */
@Configuration
@ComponentScan(basePackages = "com.tribunal.records")
public class AutoConfig {

    /**
     * The catalog kinds served by the catalog engine, fixed for the life of the process.
     */
    @Bean
    public TableConfigRegistry tableConfigRegistry() {
        return TableConfigRegistry.standard();
    }

    @Bean
    public QueryExecutor queryExecutor(JdbcTemplate jdbcTemplate, InputSanitizer inputSanitizer) {
        return new JdbcQueryExecutor(jdbcTemplate, inputSanitizer);
    }

    /**
     * Links between cases and their victims.
     */
    @Bean
    public AssociationManager caseVictimAssociations(QueryExecutor queryExecutor) {
        return new AssociationManager(AssociationConfig.PROCESO_VICTIMA, queryExecutor);
    }
}
