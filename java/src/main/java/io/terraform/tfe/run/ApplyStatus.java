package io.terraform.tfe.run;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ApplyStatus {
    CANCELED("canceled"),
    CREATED("created"),
    ERRORED("errored"),
    FINISHED("finished"),
    MFA_WAITING("mfa_waiting"),
    PENDING("pending"),
    QUEUED("queued"),
    RUNNING("running"),
    UNREACHABLE("unreachable");

    private final String value;

    ApplyStatus(String value) {
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
