package com.tribunal.records.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InputSanitizer Tests")
class InputSanitizerTest {

    private InputSanitizer inputSanitizer;

    @BeforeEach
    void setUp() {
        inputSanitizer = new InputSanitizer();
    }

    @Test
    @DisplayName("Should sanitize string by trimming whitespace")
    void shouldSanitizeStringByTrimming() {
        // Given
        String input = "  Medida cautelar  ";

        // When
        String result = inputSanitizer.sanitizeString(input);

        // Then
        assertThat(result).isEqualTo("Medida cautelar");
    }

    @Test
    @DisplayName("Should remove null bytes and control characters")
    void shouldRemoveControlCharacters() {
        // Given
        String input = "Juez\0 de\u0001 control\u001F";

        // When
        String result = inputSanitizer.sanitizeString(input);

        // Then
        assertThat(result).isEqualTo("Juez de control");
    }

    @Test
    @DisplayName("Should keep quotes and SQL-looking text untouched")
    void shouldKeepQuotesUntouched() {
        // Given
        String input = "O'Brien; DROP TABLE rol";

        // When
        String result = inputSanitizer.sanitizeString(input);

        // Then
        assertThat(result).isEqualTo(input);
    }

    @Test
    @DisplayName("Should handle null and blank input")
    void shouldHandleNullAndBlank() {
        assertThat(inputSanitizer.sanitizeString(null)).isNull();
        assertThat(inputSanitizer.sanitizeString("   ")).isEqualTo("   ");
    }

    @Test
    @DisplayName("Should sanitize string values of a payload only")
    void shouldSanitizePayload() {
        // Given
        Map<String, Object> body = new HashMap<>();
        body.put("nombre", "  Internamiento ");
        body.put("es_privativa", true);
        body.put("descripcion", null);

        // When
        Map<String, Object> result = inputSanitizer.sanitizePayload(body);

        // Then
        assertThat(result)
                .containsEntry("nombre", "Internamiento")
                .containsEntry("es_privativa", true)
                .containsEntry("descripcion", null);
        assertThat(inputSanitizer.sanitizePayload(null)).isNull();
    }

    @Test
    @DisplayName("Should mask credentials and truncate long log values")
    void shouldSanitizeForLogging() {
        // Given
        String withSecret = "[user=ana, password=hunter2]";
        String longValue = "x".repeat(1500);

        // When
        String masked = inputSanitizer.sanitizeForLogging(withSecret);
        String truncated = inputSanitizer.sanitizeForLogging(longValue);

        // Then
        assertThat(masked).isEqualTo("[user=ana, password=***]");
        assertThat(truncated).hasSize(1003).endsWith("...");
    }
}
