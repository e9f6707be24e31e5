package com.tribunal.records.annotation;

import com.tribunal.records.config.AutoConfig;
import org.springframework.context.annotation.Import;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Enables the case records catalog and association endpoints in a Spring Boot application.
 * Imports {@link com.tribunal.records.config.AutoConfig}; the application must provide a
 * {@link javax.sql.DataSource}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Import({AutoConfig.class})
public @interface EnableCaseRecords {
}
