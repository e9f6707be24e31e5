package com.tribunal.records.controller;

import com.tribunal.records.core.association.Association;
import com.tribunal.records.core.association.AssociationManager;
import com.tribunal.records.core.association.AssociationOutcome;
import com.tribunal.records.core.domain.EntityRecord;
import com.tribunal.records.dto.ApiResponse;
import com.tribunal.records.dto.AssociateVictimRequest;
import com.tribunal.records.dto.AssociateVictimsRequest;
import com.tribunal.records.util.RequestValidator;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the links between cases (procesos) and victims (victimas).
 */
@RestController
@RequestMapping("/api")
public class CaseVictimController {

    private final AssociationManager caseVictimAssociations;
    private final RequestValidator requestValidator;

    public CaseVictimController(
            @Qualifier("caseVictimAssociations") AssociationManager caseVictimAssociations,
            RequestValidator requestValidator) {
        this.caseVictimAssociations = caseVictimAssociations;
        this.requestValidator = requestValidator;
    }

    @GetMapping("/procesos/{id}/victimas")
    public ResponseEntity<ApiResponse<List<EntityRecord>>> getVictimsByCase(@PathVariable("id") Long id) {
        throwIfInvalid(requestValidator.validateId(id));
        return ResponseEntity.ok(ApiResponse.of(caseVictimAssociations.listByLeft(id),
                "Victims of the case retrieved successfully"));
    }

    @GetMapping("/procesos/{id}/victimas/count")
    public ResponseEntity<ApiResponse<Map<String, Long>>> countVictimsByCase(@PathVariable("id") Long id) {
        throwIfInvalid(requestValidator.validateId(id));
        return ResponseEntity.ok(ApiResponse.of(Map.of("total", caseVictimAssociations.countByLeft(id)),
                "Victims of the case counted successfully"));
    }

    @PostMapping("/procesos/{id}/victimas")
    public ResponseEntity<ApiResponse<Association>> associate(
            @PathVariable("id") Long id,
            @Valid @RequestBody AssociateVictimRequest request) {
        throwIfInvalid(requestValidator.validateId(id));
        Association association = caseVictimAssociations.associate(id, request.getVictimaId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.of(association, "Victim associated with the case successfully"));
    }

    /**
     * Links several victims at once; the response lists one outcome per requested id.
     */
    @PostMapping("/procesos/{id}/victimas/multiples")
    public ResponseEntity<ApiResponse<List<AssociationOutcome>>> associateMany(
            @PathVariable("id") Long id,
            @Valid @RequestBody AssociateVictimsRequest request) {
        throwIfInvalid(requestValidator.validateId(id));
        List<AssociationOutcome> outcomes = caseVictimAssociations.associateMany(id, request.getVictimasIds());
        return ResponseEntity.ok(ApiResponse.of(outcomes, "Association batch completed"));
    }

    @GetMapping("/procesos/{id}/victimas/{victimaId}")
    public ResponseEntity<ApiResponse<Map<String, Boolean>>> isAssociated(
            @PathVariable("id") Long id,
            @PathVariable("victimaId") Long victimaId) {
        List<String> errors = requestValidator.validateId(id);
        errors.addAll(requestValidator.validateId(victimaId));
        throwIfInvalid(errors);
        boolean associated = caseVictimAssociations.exists(id, victimaId);
        return ResponseEntity.ok(ApiResponse.of(Map.of("associated", associated), "Association checked"));
    }

    @DeleteMapping("/procesos/{id}/victimas/{victimaId}")
    public ResponseEntity<ApiResponse<Association>> disassociate(
            @PathVariable("id") Long id,
            @PathVariable("victimaId") Long victimaId) {
        List<String> errors = requestValidator.validateId(id);
        errors.addAll(requestValidator.validateId(victimaId));
        throwIfInvalid(errors);
        Association removed = caseVictimAssociations.disassociate(id, victimaId);
        return ResponseEntity.ok(ApiResponse.of(removed, "Victim removed from the case successfully"));
    }

    @GetMapping("/victimas/{id}/procesos")
    public ResponseEntity<ApiResponse<List<EntityRecord>>> getCasesByVictim(@PathVariable("id") Long id) {
        throwIfInvalid(requestValidator.validateId(id));
        return ResponseEntity.ok(ApiResponse.of(caseVictimAssociations.listByRight(id),
                "Cases of the victim retrieved successfully"));
    }

    private void throwIfInvalid(List<String> validationErrors) {
        if (!validationErrors.isEmpty()) {
            throw new IllegalArgumentException(String.join(", ", validationErrors));
        }
    }
}
