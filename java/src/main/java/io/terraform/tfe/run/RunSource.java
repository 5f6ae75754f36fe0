package io.terraform.tfe.run;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a run was queued from.
 */
public enum RunSource {
    API("tfe-api"),
    CONFIGURATION_VERSION("tfe-configuration-version"),
    UI("tfe-ui"),
    TERRAFORM_CLOUD("terraform+cloud");

    private final String value;

    RunSource(String value) {
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
