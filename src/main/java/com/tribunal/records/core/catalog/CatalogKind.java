package com.tribunal.records.core.catalog;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of catalog kinds served by {@link CatalogEngine}.
 * Adding a catalog means adding a constant here.
 */
public enum CatalogKind {

    ROLES(TableConfig.builder()
            .kind("roles")
            .table("rol")
            .idColumn("id_rol")
            .nameColumn("nombre")
            .hasDescription(true)
            .label("role")
            .build()),

    PROCEDURAL_STATES(TableConfig.builder()
            .kind("estados-procesales")
            .table("estado_procesal")
            .idColumn("id_estado")
            .nameColumn("nombre")
            .label("procedural state")
            .build()),

    STATUS(TableConfig.builder()
            .kind("status")
            .table("status")
            .idColumn("id_status")
            .nameColumn("nombre")
            .label("status")
            .build()),

    SANCTION_MEASURE_TYPES(TableConfig.builder()
            .kind("tipos-medidas-sancionadoras")
            .table("tipo_medida_sancionadora")
            .idColumn("id_tipo_medida_sancionadora")
            .nameColumn("nombre")
            .extraColumn(ExtraColumn.of("es_privativa", ColumnType.BOOLEAN))
            .label("sanction measure type")
            .build()),

    PRECAUTIONARY_MEASURE_TYPES(TableConfig.builder()
            .kind("tipos-medidas-cautelares")
            .table("tipo_medida_cautelar")
            .idColumn("id_tipo_medida_cautelar")
            .nameColumn("nombre")
            .extraColumn(ExtraColumn.of("genera_cemci", ColumnType.BOOLEAN))
            .label("precautionary measure type")
            .build()),

    REPARATION_TYPES(TableConfig.builder()
            .kind("tipos-reparacion")
            .table("tipo_reparacion")
            .idColumn("id_tipo_reparacion")
            .nameColumn("nombre")
            .label("reparation type")
            .build());

    private final TableConfig config;

    CatalogKind(TableConfig config) {
        this.config = config;
    }

    public TableConfig getConfig() {
        return config;
    }

    public String getSlug() {
        return config.getKind();
    }

    public static Optional<CatalogKind> fromSlug(String slug) {
        return Arrays.stream(values())
                .filter(kind -> kind.getSlug().equals(slug))
                .findFirst();
    }
}
