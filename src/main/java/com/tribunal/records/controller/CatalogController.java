package com.tribunal.records.controller;

import com.tribunal.records.config.CaseRecordsProperties;
import com.tribunal.records.core.catalog.CatalogEngine;
import com.tribunal.records.core.catalog.CatalogKind;
import com.tribunal.records.core.catalog.CatalogPayload;
import com.tribunal.records.core.catalog.CatalogQuery;
import com.tribunal.records.core.catalog.CatalogRecord;
import com.tribunal.records.core.catalog.CatalogStats;
import com.tribunal.records.core.catalog.TableConfig;
import com.tribunal.records.core.catalog.TableConfigRegistry;
import com.tribunal.records.dto.ApiResponse;
import com.tribunal.records.dto.Pagination;
import com.tribunal.records.util.InputSanitizer;
import com.tribunal.records.util.PaginationParams;
import com.tribunal.records.util.RequestValidator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the catalog tables.
 * The {@code tipo} path variable selects the catalog; unknown values are rejected before
 * they reach the {@link CatalogEngine}.
 */
@RestController
@RequestMapping("/api/catalogos/{tipo}")
public class CatalogController {

    private final CatalogEngine catalogEngine;
    private final TableConfigRegistry registry;
    private final RequestValidator requestValidator;
    private final InputSanitizer inputSanitizer;
    private final CaseRecordsProperties properties;

    public CatalogController(
            CatalogEngine catalogEngine,
            TableConfigRegistry registry,
            RequestValidator requestValidator,
            InputSanitizer inputSanitizer,
            CaseRecordsProperties properties) {
        this.catalogEngine = catalogEngine;
        this.registry = registry;
        this.requestValidator = requestValidator;
        this.inputSanitizer = inputSanitizer;
        this.properties = properties;
    }

    /**
     * Lists a catalog by name. Paginated when {@code page} or {@code limit} is given,
     * the whole catalog otherwise.
     * @param tipo the catalog kind
     * @param search optional case-insensitive name filter
     * @param page 1-based page number
     * @param limit page size
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<CatalogRecord>>> getAll(
            @PathVariable("tipo") String tipo,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        resolveKind(tipo);
        int maxLimit = properties.getPagination().getMaxLimit();
        throwIfInvalid(requestValidator.validatePagination(page, limit, search, maxLimit));
        String term = inputSanitizer.sanitizeString(search);

        if (page == null && limit == null) {
            List<CatalogRecord> data = catalogEngine.list(tipo, CatalogQuery.search(term));
            return ResponseEntity.ok(ApiResponse.of(data, tipo + " retrieved successfully"));
        }

        PaginationParams paging = PaginationParams.of(page, limit,
                properties.getPagination().getDefaultLimit(), maxLimit);
        List<CatalogRecord> data = catalogEngine.list(tipo,
                CatalogQuery.page(term, paging.getLimit(), paging.getOffset()));
        long total = catalogEngine.count(tipo, term);
        Pagination pagination = Pagination.of(paging.getPage(), paging.getLimit(), total);
        return ResponseEntity.ok(ApiResponse.paginated(data, pagination, tipo + " retrieved successfully"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<CatalogStats>> getStats(@PathVariable("tipo") String tipo) {
        resolveKind(tipo);
        return ResponseEntity.ok(ApiResponse.of(catalogEngine.stats(tipo), "Statistics retrieved successfully"));
    }

    /**
     * Tells whether a record already uses a name, optionally ignoring one record.
     */
    @GetMapping("/exists")
    public ResponseEntity<ApiResponse<Map<String, Boolean>>> existsByName(
            @PathVariable("tipo") String tipo,
            @RequestParam("nombre") String nombre,
            @RequestParam(required = false) Long excludeId) {
        resolveKind(tipo);
        boolean exists = catalogEngine.existsByName(tipo, inputSanitizer.sanitizeString(nombre), excludeId);
        return ResponseEntity.ok(ApiResponse.of(Map.of("exists", exists), "Name checked"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<CatalogRecord>> getById(
            @PathVariable("tipo") String tipo,
            @PathVariable("id") Long id) {
        resolveKind(tipo);
        throwIfInvalid(requestValidator.validateId(id));
        return ResponseEntity.ok(ApiResponse.of(catalogEngine.getById(tipo, id), "Record retrieved successfully"));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<CatalogRecord>> create(
            @PathVariable("tipo") String tipo,
            @RequestBody Map<String, Object> createReq) {
        TableConfig config = resolveKind(tipo);
        Map<String, Object> body = inputSanitizer.sanitizePayload(createReq);
        throwIfInvalid(requestValidator.validateCatalogCreate(config, body));

        CatalogRecord created = catalogEngine.create(tipo, CatalogPayload.fromRequest(body, config));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.of(created, "Record created successfully"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<CatalogRecord>> update(
            @PathVariable("tipo") String tipo,
            @PathVariable("id") Long id,
            @RequestBody Map<String, Object> updateReq) {
        TableConfig config = resolveKind(tipo);
        Map<String, Object> body = inputSanitizer.sanitizePayload(updateReq);
        List<String> errors = requestValidator.validateId(id);
        errors.addAll(requestValidator.validateCatalogUpdate(config, body));
        throwIfInvalid(errors);

        CatalogRecord updated = catalogEngine.update(tipo, id, CatalogPayload.fromRequest(body, config));
        return ResponseEntity.ok(ApiResponse.of(updated, "Record updated successfully"));
    }

    /**
     * Deletes a record and returns it as it was.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<CatalogRecord>> delete(
            @PathVariable("tipo") String tipo,
            @PathVariable("id") Long id) {
        resolveKind(tipo);
        throwIfInvalid(requestValidator.validateId(id));
        return ResponseEntity.ok(ApiResponse.of(catalogEngine.remove(tipo, id), "Record deleted successfully"));
    }

    private TableConfig resolveKind(String tipo) {
        CatalogKind kind = CatalogKind.fromSlug(tipo)
                .orElseThrow(() -> new IllegalArgumentException("Invalid catalog type: " + tipo));
        return registry.resolve(kind);
    }

    private void throwIfInvalid(List<String> validationErrors) {
        if (!validationErrors.isEmpty()) {
            throw new IllegalArgumentException(String.join(", ", validationErrors));
        }
    }
}
