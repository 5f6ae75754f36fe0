package io.terraform.tfe.variableset;

import io.terraform.tfe.workspace.Workspace;

import java.util.List;

/**
 * Workspaces to attach to or detach from a variable set.
 */
public record VariableSetWorkspacesOptions(List<Workspace> workspaces) {

    public VariableSetWorkspacesOptions {
        workspaces = workspaces == null ? List.of() : List.copyOf(workspaces);
    }

    public static VariableSetWorkspacesOptions of(Workspace... workspaces) {
        return new VariableSetWorkspacesOptions(List.of(workspaces));
    }
}
