package com.tribunal.records.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of a bulk request linking several victims to a case.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssociateVictimsRequest {

    @NotEmpty(message = "victimas_ids must be an array with at least one id")
    @JsonProperty("victimas_ids")
    private List<Long> victimasIds;
}
