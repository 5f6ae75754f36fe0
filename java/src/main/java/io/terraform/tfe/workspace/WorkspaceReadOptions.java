package io.terraform.tfe.workspace;

import io.terraform.tfe.QueryOptions;
import io.terraform.tfe.QueryValues;

import java.util.ArrayList;
import java.util.List;

public final class WorkspaceReadOptions implements QueryOptions {

    private final List<WorkspaceIncludeOpt> include = new ArrayList<>();

    public WorkspaceReadOptions include(WorkspaceIncludeOpt... relations) {
        include.addAll(List.of(relations));
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        values.addAll("include", include);
    }
}
