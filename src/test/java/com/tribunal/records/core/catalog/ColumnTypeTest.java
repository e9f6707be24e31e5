package com.tribunal.records.core.catalog;

import com.tribunal.records.exception.BadRequestException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ColumnType Tests")
class ColumnTypeTest {

    @Test
    @DisplayName("Should accept booleans and their 0/1 and text forms")
    void shouldAcceptBooleanForms() {
        assertThat(ColumnType.BOOLEAN.accepts(true)).isTrue();
        assertThat(ColumnType.BOOLEAN.accepts(0)).isTrue();
        assertThat(ColumnType.BOOLEAN.accepts("false")).isTrue();
        assertThat(ColumnType.BOOLEAN.accepts("1")).isTrue();
    }

    @Test
    @DisplayName("Should refuse null and anything that is not a boolean")
    void shouldRefuseNonBooleans() {
        assertThat(ColumnType.BOOLEAN.accepts(null)).isFalse();
        assertThat(ColumnType.BOOLEAN.accepts("yes")).isFalse();
        assertThat(ColumnType.BOOLEAN.accepts(2)).isFalse();
    }

    @Test
    @DisplayName("Should coerce accepted values to Boolean")
    void shouldCoerceToBoolean() {
        assertThat(ColumnType.BOOLEAN.coerce("es_privativa", 1)).isEqualTo(Boolean.TRUE);
        assertThat(ColumnType.BOOLEAN.coerce("es_privativa", "FALSE")).isEqualTo(Boolean.FALSE);
        assertThat(ColumnType.BOOLEAN.coerce("es_privativa", null)).isNull();
    }

    @Test
    @DisplayName("Should reject a value that cannot be coerced")
    void shouldRejectUncoercibleValue() {
        assertThatThrownBy(() -> ColumnType.BOOLEAN.coerce("genera_cemci", "maybe"))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Field genera_cemci must be a boolean value");
    }
}
