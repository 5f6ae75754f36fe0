package io.terraform.tfe.run;

import io.terraform.tfe.LogReader;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.io.OutputStream;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import static io.terraform.tfe.internal.QueryEncoder.escape;
import static io.terraform.tfe.internal.Validation.validStringId;

public final class Plans {

    private static final Set<PlanStatus> FINAL_STATUSES = EnumSet.of(
        PlanStatus.CANCELED, PlanStatus.ERRORED, PlanStatus.FINISHED, PlanStatus.UNREACHABLE);

    private final TfeClient client;

    public Plans(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public Plan read(String planId) throws TfeException {
        if (!validStringId(planId)) {
            throw new TfeException(TfeError.INVALID_PLAN_ID);
        }
        return client.newRequest("GET", "plans/" + escape(planId), null, null).decode(Plan.class);
    }

    /**
     * Copies the plan's JSON execution plan into {@code out}.
     *
     * @return the number of bytes written.
     */
    public long readJsonOutput(String planId, OutputStream out) throws TfeException {
        if (!validStringId(planId)) {
            throw new TfeException(TfeError.INVALID_PLAN_ID);
        }
        return client.newRequest("GET", "plans/" + escape(planId) + "/json-output", null, null).writeTo(out);
    }

    /**
     * Opens a stream over the plan's log. The stream ends once the log is complete and the plan reached a final
     * state; the plan is re-read to find out.
     */
    public LogReader logs(String planId) throws TfeException {
        Plan plan = read(planId);
        return client.newLogReader(
            LogUrls.parse("plan", planId, plan.getLogReadUrl()),
            () -> FINAL_STATUSES.contains(read(planId).getStatus()));
    }
}
