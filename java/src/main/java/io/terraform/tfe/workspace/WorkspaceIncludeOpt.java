package io.terraform.tfe.workspace;

/**
 * Relations that can be side-loaded with workspaces.
 */
public enum WorkspaceIncludeOpt {
    ORGANIZATION("organization"),
    CURRENT_RUN("current_run"),
    CURRENT_RUN_PLAN("current_run.plan"),
    CURRENT_STATE_VERSION("current_state_version"),
    PROJECT("project"),
    LOCKED_BY("locked_by");

    private final String value;

    WorkspaceIncludeOpt(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return value;
    }
}
