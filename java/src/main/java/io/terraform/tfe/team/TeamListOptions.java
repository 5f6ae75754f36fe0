package io.terraform.tfe.team;

import io.terraform.tfe.ListOptions;
import io.terraform.tfe.QueryValues;

import java.util.ArrayList;
import java.util.List;

public final class TeamListOptions extends ListOptions<TeamListOptions> {

    private final List<String> names = new ArrayList<>();
    private final List<TeamIncludeOpt> include = new ArrayList<>();
    private String query;

    /**
     * Restricts the result to teams with these exact names.
     */
    public TeamListOptions names(String... names) {
        this.names.addAll(List.of(names));
        return this;
    }

    public TeamListOptions query(String query) {
        this.query = query;
        return this;
    }

    public TeamListOptions include(TeamIncludeOpt... relations) {
        include.addAll(List.of(relations));
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        super.appendTo(values);
        values.addAll("filter[names]", names);
        values.add("q", query);
        values.addAll("include", include);
    }

    @Override
    protected TeamListOptions self() {
        return this;
    }
}
