package io.terraform.tfe.run;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {
    APPLIED("applied"),
    APPLY_QUEUED("apply_queued"),
    APPLYING("applying"),
    CANCELED("canceled"),
    CONFIRMED("confirmed"),
    COST_ESTIMATED("cost_estimated"),
    COST_ESTIMATING("cost_estimating"),
    DISCARDED("discarded"),
    ERRORED("errored"),
    FETCHING("fetching"),
    FETCHING_COMPLETED("fetching_completed"),
    PENDING("pending"),
    PLAN_QUEUED("plan_queued"),
    PLANNED("planned"),
    PLANNED_AND_FINISHED("planned_and_finished"),
    PLANNING("planning"),
    POLICY_CHECKED("policy_checked"),
    POLICY_CHECKING("policy_checking"),
    POLICY_OVERRIDE("policy_override"),
    POLICY_SOFT_FAILED("policy_soft_failed"),
    POST_PLAN_COMPLETED("post_plan_completed"),
    POST_PLAN_RUNNING("post_plan_running"),
    PRE_APPLY_RUNNING("pre_apply_running"),
    PRE_PLAN_COMPLETED("pre_plan_completed"),
    PRE_PLAN_RUNNING("pre_plan_running"),
    QUEUING("queuing");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
