package io.terraform.tfe.audittrail;

import io.terraform.tfe.ListOptions;
import io.terraform.tfe.QueryValues;

import java.time.Instant;

public final class AuditTrailListOptions extends ListOptions<AuditTrailListOptions> {

    private Instant since;

    /**
     * Only events recorded after this instant.
     */
    public AuditTrailListOptions since(Instant since) {
        this.since = since;
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        super.appendTo(values);
        values.add("since", since == null ? null : since.toString());
    }

    @Override
    protected AuditTrailListOptions self() {
        return this;
    }
}
