package io.terraform.tfe.audittrail;

import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeException;

import java.util.Objects;

/**
 * Audit events of the organization the API token belongs to. Requires an organization token.
 */
public final class AuditTrails {

    private final TfeClient client;

    public AuditTrails(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public AuditTrailList list(AuditTrailListOptions options) throws TfeException {
        return client.newJsonRequest("GET", "organization/audit-trail", null, options)
            .decodeJson(AuditTrailList.class);
    }
}
