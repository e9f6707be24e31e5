package com.tribunal.records.core.jdbc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
@DisplayName("JdbcQueryExecutor Tests")
class JdbcQueryExecutorTest {

    @Autowired
    private QueryExecutor queryExecutor;

    @Test
    @DisplayName("Should return the generated key of an insert")
    void shouldReturnGeneratedKey() {
        // When
        long first = queryExecutor.insert("INSERT INTO tipo_reparacion (nombre) VALUES (?)", "id_tipo_reparacion", "Uno");
        long second = queryExecutor.insert("INSERT INTO tipo_reparacion (nombre) VALUES (?)", "id_tipo_reparacion", "Dos");

        // Then
        assertThat(second).isGreaterThan(first);
        List<Map<String, Object>> rows = queryExecutor.query(
                "SELECT nombre FROM tipo_reparacion WHERE id_tipo_reparacion = ?", second);
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).get("nombre")).isEqualTo("Dos");
    }

    @Test
    @DisplayName("Should signal a duplicate key")
    void shouldSignalDuplicateKey() {
        // Given
        queryExecutor.update("INSERT INTO status (nombre) VALUES (?)", "Activo");

        // When & Then
        assertThatThrownBy(() -> queryExecutor.insert("INSERT INTO status (nombre) VALUES (?)", "id_status", "Activo"))
                .isInstanceOf(DuplicateKeyViolation.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Should signal a row other rows still reference")
    void shouldSignalReferencedRow() {
        // Given
        long statusId = queryExecutor.insert("INSERT INTO status (nombre) VALUES (?)", "id_status", "Activo");
        queryExecutor.update("INSERT INTO proceso (status_id) VALUES (?)", statusId);

        // When & Then
        assertThatThrownBy(() -> queryExecutor.update("DELETE FROM status WHERE id_status = ?", statusId))
                .isInstanceOf(ReferencedRowViolation.class);
    }

    @Test
    @DisplayName("Should pass other integrity violations through untouched")
    void shouldPassOtherViolationsThrough() {
        assertThatThrownBy(() -> queryExecutor.update("INSERT INTO proceso (status_id) VALUES (?)", 999_999))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
