package io.terraform.tfe.variableset;

public enum VariableSetIncludeOpt {
    WORKSPACES("workspaces"),
    PROJECTS("projects"),
    VARIABLES("vars");

    private final String value;

    VariableSetIncludeOpt(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return value;
    }
}
