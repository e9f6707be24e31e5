package com.tribunal.records.core.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * The mutable fields a caller supplies for a catalog record.
 * <p>
 * Presence of the description is tracked apart from its value so an update can clear it.
 * Extra columns are carried only when the request named them.
 */
@Value
@Builder
public class CatalogPayload {

    public static final String NAME_FIELD = "nombre";
    public static final String DESCRIPTION_FIELD = "descripcion";

    String name;
    boolean descriptionPresent;
    String description;
    @Singular
    Map<String, Object> extras;

    /**
     * Extracts the fields a catalog of the given shape understands from a request body.
     * Keys the catalog does not know are ignored.
     */
    public static CatalogPayload fromRequest(Map<String, Object> body, TableConfig config) {
        CatalogPayloadBuilder builder = CatalogPayload.builder();
        Object name = body.get(NAME_FIELD);
        if (name != null) {
            builder.name(name.toString());
        }
        if (body.containsKey(DESCRIPTION_FIELD)) {
            Object description = body.get(DESCRIPTION_FIELD);
            builder.description(description != null ? description.toString() : null);
        }
        for (ExtraColumn column : config.getExtraColumns()) {
            if (body.containsKey(column.getName())) {
                builder.extra(column.getName(), body.get(column.getName()));
            }
        }
        return builder.build();
    }

    public static class CatalogPayloadBuilder {

        public CatalogPayloadBuilder description(String description) {
            this.description = description;
            this.descriptionPresent = true;
            return this;
        }
    }
}
