package io.terraform.tfe.audittrail;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * One audit event of an organization.
 */
public record AuditTrail(
    @JsonProperty("id") String id,
    @JsonProperty("version") String version,
    @JsonProperty("type") String type,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("auth") Auth auth,
    @JsonProperty("request") Request request,
    @JsonProperty("resource") Resource resource
) {

    /**
     * Who performed the action. {@code type} is {@code Client}, {@code Impersonated} or {@code System}.
     */
    public record Auth(
        @JsonProperty("accessor_id") String accessorId,
        @JsonProperty("description") String description,
        @JsonProperty("type") String type,
        @JsonProperty("impersonator_id") String impersonatorId,
        @JsonProperty("organization_id") String organizationId
    ) {
    }

    public record Request(@JsonProperty("id") String id) {
    }

    public record Resource(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("action") String action,
        @JsonProperty("meta") Map<String, Object> meta
    ) {
    }
}
