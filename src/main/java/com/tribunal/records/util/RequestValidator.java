package com.tribunal.records.util;

import com.tribunal.records.core.catalog.CatalogPayload;
import com.tribunal.records.core.catalog.ExtraColumn;
import com.tribunal.records.core.catalog.TableConfig;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Structural validation of HTTP input before it reaches the engines.
 * Every method returns the list of violations found, empty when the input is valid.
 */
@Component
public class RequestValidator {

    static final int MAX_TEXT_LENGTH = 150;
    static final int MAX_SEARCH_LENGTH = 100;

    /**
     * Validates that an id is present and positive.
     */
    public List<String> validateId(Long id) {
        List<String> errors = new ArrayList<>();
        if (id == null) {
            errors.add("ID cannot be null");
        } else if (id < 1) {
            errors.add("ID must be a positive integer");
        }
        return errors;
    }

    /**
     * Validates paging and search query parameters; each one is optional.
     */
    public List<String> validatePagination(Integer page, Integer limit, String search, int maxLimit) {
        List<String> errors = new ArrayList<>();
        if (page != null && page < 1) {
            errors.add("Page must be an integer greater than 0");
        }
        if (limit != null && (limit < 1 || limit > maxLimit)) {
            errors.add("Limit must be between 1 and " + maxLimit);
        }
        if (search != null && search.length() > MAX_SEARCH_LENGTH) {
            errors.add("Search cannot be longer than " + MAX_SEARCH_LENGTH + " characters");
        }
        return errors;
    }

    /**
     * Validates the body of a catalog creation: the name is required.
     */
    public List<String> validateCatalogCreate(TableConfig config, Map<String, Object> body) {
        List<String> errors = new ArrayList<>();
        if (body == null) {
            errors.add("Request body cannot be null");
            return errors;
        }
        Object name = body.get(CatalogPayload.NAME_FIELD);
        if (name == null || !StringUtils.hasText(name.toString())) {
            errors.add("Field " + CatalogPayload.NAME_FIELD + " is required");
        } else {
            checkLength(errors, CatalogPayload.NAME_FIELD, name);
        }
        validateOptionalFields(errors, config, body);
        return errors;
    }

    /**
     * Validates the body of a catalog update: every field is optional but a name, when given,
     * cannot be blank.
     */
    public List<String> validateCatalogUpdate(TableConfig config, Map<String, Object> body) {
        List<String> errors = new ArrayList<>();
        if (body == null) {
            errors.add("Request body cannot be null");
            return errors;
        }
        if (body.containsKey(CatalogPayload.NAME_FIELD)) {
            Object name = body.get(CatalogPayload.NAME_FIELD);
            if (name == null || !StringUtils.hasText(name.toString())) {
                errors.add("Field " + CatalogPayload.NAME_FIELD + " cannot be empty");
            } else {
                checkLength(errors, CatalogPayload.NAME_FIELD, name);
            }
        }
        validateOptionalFields(errors, config, body);
        return errors;
    }

    private void validateOptionalFields(List<String> errors, TableConfig config, Map<String, Object> body) {
        Object description = body.get(CatalogPayload.DESCRIPTION_FIELD);
        if (description != null) {
            checkLength(errors, CatalogPayload.DESCRIPTION_FIELD, description);
        }
        for (ExtraColumn column : config.getExtraColumns()) {
            if (body.containsKey(column.getName()) && !column.getType().accepts(body.get(column.getName()))) {
                errors.add("Field " + column.getName() + " must be true or false");
            }
        }
    }

    private void checkLength(List<String> errors, String field, Object value) {
        if (value.toString().length() > MAX_TEXT_LENGTH) {
            errors.add("Field " + field + " cannot be longer than " + MAX_TEXT_LENGTH + " characters");
        }
    }
}
