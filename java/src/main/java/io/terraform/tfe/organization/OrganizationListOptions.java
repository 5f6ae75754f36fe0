package io.terraform.tfe.organization;

import io.terraform.tfe.ListOptions;
import io.terraform.tfe.QueryValues;

public final class OrganizationListOptions extends ListOptions<OrganizationListOptions> {

    private String query;

    /**
     * Filters organizations by a partial name or email match.
     */
    public OrganizationListOptions query(String query) {
        this.query = query;
        return this;
    }

    public String getQuery() {
        return query;
    }

    @Override
    public void appendTo(QueryValues values) {
        super.appendTo(values);
        values.add("q", query);
    }

    @Override
    protected OrganizationListOptions self() {
        return this;
    }
}
