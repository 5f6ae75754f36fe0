package io.terraform.tfe.workspace;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WorkspacePermissions(
    @JsonProperty("can-destroy") boolean canDestroy,
    @JsonProperty("can-force-unlock") boolean canForceUnlock,
    @JsonProperty("can-lock") boolean canLock,
    @JsonProperty("can-queue-apply") boolean canQueueApply,
    @JsonProperty("can-queue-destroy") boolean canQueueDestroy,
    @JsonProperty("can-queue-run") boolean canQueueRun,
    @JsonProperty("can-read-settings") boolean canReadSettings,
    @JsonProperty("can-unlock") boolean canUnlock,
    @JsonProperty("can-update") boolean canUpdate,
    @JsonProperty("can-update-variable") boolean canUpdateVariable
) {
}
