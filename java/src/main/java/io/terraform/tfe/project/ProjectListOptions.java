package io.terraform.tfe.project;

import io.terraform.tfe.ListOptions;
import io.terraform.tfe.QueryValues;

public final class ProjectListOptions extends ListOptions<ProjectListOptions> {

    private String name;
    private String query;

    /**
     * Exact project name to match.
     */
    public ProjectListOptions name(String name) {
        this.name = name;
        return this;
    }

    public ProjectListOptions query(String query) {
        this.query = query;
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        super.appendTo(values);
        values.add("filter[names]", name);
        values.add("q", query);
    }

    @Override
    protected ProjectListOptions self() {
        return this;
    }
}
