package io.terraform.tfe.notification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationTrigger {
    CREATED("run:created"),
    PLANNING("run:planning"),
    NEEDS_ATTENTION("run:needs_attention"),
    APPLYING("run:applying"),
    COMPLETED("run:completed"),
    ERRORED("run:errored"),
    ASSESSMENT_DRIFTED("assessment:drifted"),
    ASSESSMENT_FAILED("assessment:failed"),
    ASSESSMENT_CHECK_FAILED("assessment:check_failure"),
    WORKSPACE_AUTO_DESTROY_REMINDER("workspace:auto_destroy_reminder"),
    WORKSPACE_AUTO_DESTROY_RUN_RESULTS("workspace:auto_destroy_run_results"),
    // Team subscriptions only.
    CHANGE_REQUEST_CREATED("change_request:created");

    private final String value;

    NotificationTrigger(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    boolean appliesToWorkspaces() {
        return this != CHANGE_REQUEST_CREATED;
    }

    @Override
    public String toString() {
        return value;
    }
}
