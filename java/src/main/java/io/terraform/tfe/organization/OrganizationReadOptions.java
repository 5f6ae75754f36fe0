package io.terraform.tfe.organization;

import io.terraform.tfe.QueryOptions;
import io.terraform.tfe.QueryValues;

import java.util.ArrayList;
import java.util.List;

public final class OrganizationReadOptions implements QueryOptions {

    public static final String INCLUDE_ENTITLEMENT_SET = "entitlement-set";

    private final List<String> include = new ArrayList<>();

    public OrganizationReadOptions include(String... relations) {
        include.addAll(List.of(relations));
        return this;
    }

    public List<String> getInclude() {
        return List.copyOf(include);
    }

    @Override
    public void appendTo(QueryValues values) {
        values.addAll("include", include);
    }
}
