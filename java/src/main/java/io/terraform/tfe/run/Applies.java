package io.terraform.tfe.run;

import io.terraform.tfe.LogReader;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import static io.terraform.tfe.internal.QueryEncoder.escape;
import static io.terraform.tfe.internal.Validation.validStringId;

public final class Applies {

    private static final Set<ApplyStatus> FINAL_STATUSES = EnumSet.of(
        ApplyStatus.CANCELED, ApplyStatus.ERRORED, ApplyStatus.FINISHED, ApplyStatus.UNREACHABLE);

    private final TfeClient client;

    public Applies(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public Apply read(String applyId) throws TfeException {
        if (!validStringId(applyId)) {
            throw new TfeException(TfeError.INVALID_APPLY_ID);
        }
        return client.newRequest("GET", "applies/" + escape(applyId), null, null).decode(Apply.class);
    }

    /**
     * Opens a stream over the apply's log. The stream ends once the log is complete and the apply reached a final
     * state; the apply is re-read to find out.
     */
    public LogReader logs(String applyId) throws TfeException {
        Apply apply = read(applyId);
        return client.newLogReader(
            LogUrls.parse("apply", applyId, apply.getLogReadUrl()),
            () -> FINAL_STATUSES.contains(read(applyId).getStatus()));
    }
}
