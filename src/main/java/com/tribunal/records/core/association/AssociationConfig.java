package com.tribunal.records.core.association;

import lombok.Builder;
import lombok.Value;

/**
 * Schema of a many-to-many link table and the two entity tables it joins.
 * Like catalog configurations, instances only come from static code.
 */
@Value
@Builder
public class AssociationConfig {

    /**
     * Case to victim. Victims list by name, cases most recent first with the name and
     * initials of the adolescent each case belongs to.
     */
    public static final AssociationConfig PROCESO_VICTIMA = AssociationConfig.builder()
            .linkTable("proceso_victima")
            .leftColumn("proceso_id")
            .rightColumn("victima_id")
            .left(EntityTable.builder()
                    .table("proceso")
                    .idColumn("id_proceso")
                    .label("case")
                    .orderColumn("id_proceso")
                    .orderDescending(true)
                    .join(EntityJoin.builder()
                            .table("adolescente")
                            .alias("a")
                            .foreignKey("adolescente_id")
                            .referencedColumn("id_adolescente")
                            .column("nombre", "adolescente_nombre")
                            .column("iniciales", "adolescente_iniciales")
                            .build())
                    .build())
            .right(EntityTable.builder()
                    .table("victima")
                    .idColumn("id_victima")
                    .label("victim")
                    .orderColumn("nombre")
                    .build())
            .build();

    String linkTable;
    String leftColumn;
    String rightColumn;
    EntityTable left;
    EntityTable right;
}
