package io.terraform.tfe.team;

public enum TeamIncludeOpt {
    USERS("users"),
    ORGANIZATION_MEMBERSHIPS("organization-memberships");

    private final String value;

    TeamIncludeOpt(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return value;
    }
}
