package io.terraform.tfe.variableset;

import io.terraform.tfe.ListOptions;
import io.terraform.tfe.QueryValues;

import java.util.ArrayList;
import java.util.List;

public final class VariableSetListOptions extends ListOptions<VariableSetListOptions> {

    private String query;
    private final List<VariableSetIncludeOpt> include = new ArrayList<>();

    public VariableSetListOptions query(String query) {
        this.query = query;
        return this;
    }

    public VariableSetListOptions include(VariableSetIncludeOpt... relations) {
        include.addAll(List.of(relations));
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        super.appendTo(values);
        values.add("q", query);
        values.addAll("include", include);
    }

    @Override
    protected VariableSetListOptions self() {
        return this;
    }
}
