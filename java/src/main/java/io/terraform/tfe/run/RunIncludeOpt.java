package io.terraform.tfe.run;

public enum RunIncludeOpt {
    PLAN("plan"),
    APPLY("apply"),
    CREATED_BY("created_by"),
    WORKSPACE("workspace"),
    CONFIGURATION_VERSION("configuration_version");

    private final String value;

    RunIncludeOpt(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return value;
    }
}
