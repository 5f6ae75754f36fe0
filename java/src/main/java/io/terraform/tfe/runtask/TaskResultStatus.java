package io.terraform.tfe.runtask;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskResultStatus {
    PASSED("passed"),
    FAILED("failed"),
    RUNNING("running"),
    PENDING("pending"),
    UNREACHABLE("unreachable");

    private final String value;

    TaskResultStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Whether an integration may report this status through the callback.
     */
    public boolean isReportable() {
        return this == PASSED || this == FAILED || this == RUNNING;
    }

    @Override
    public String toString() {
        return value;
    }
}
