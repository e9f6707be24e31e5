package com.tribunal.records.core.association;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Result of one item of a bulk association.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AssociationOutcome {

    public enum Status {
        ASSOCIATED,
        FAILED
    }

    Long rightId;
    Status status;
    /** Why the item failed; absent on success. */
    String reason;

    public static AssociationOutcome associated(Long rightId) {
        return new AssociationOutcome(rightId, Status.ASSOCIATED, null);
    }

    public static AssociationOutcome failed(Long rightId, String reason) {
        return new AssociationOutcome(rightId, Status.FAILED, reason);
    }

    @JsonIgnore
    public boolean isAssociated() {
        return status == Status.ASSOCIATED;
    }
}
