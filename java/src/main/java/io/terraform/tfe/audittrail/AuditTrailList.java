package io.terraform.tfe.audittrail;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.terraform.tfe.Pagination;

import java.util.List;

/**
 * The audit trail endpoint answers in plain JSON with its own top-level pagination block.
 */
public record AuditTrailList(
    @JsonProperty("pagination") Pagination pagination,
    @JsonProperty("data") List<AuditTrail> items
) {

    public AuditTrailList {
        pagination = pagination == null ? Pagination.EMPTY : pagination;
        items = items == null ? List.of() : items;
    }
}
