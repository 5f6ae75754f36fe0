package io.terraform.tfe.agentpool;

public enum AgentPoolIncludeOpt {
    WORKSPACES("workspaces");

    private final String value;

    AgentPoolIncludeOpt(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return value;
    }
}
