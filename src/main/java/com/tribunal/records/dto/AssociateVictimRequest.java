package com.tribunal.records.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a request linking one victim to a case.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssociateVictimRequest {

    @NotNull(message = "victima_id is required")
    @Positive(message = "victima_id must be a positive integer")
    @JsonProperty("victima_id")
    private Long victimaId;
}
