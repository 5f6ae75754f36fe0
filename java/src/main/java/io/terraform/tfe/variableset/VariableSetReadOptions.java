package io.terraform.tfe.variableset;

import io.terraform.tfe.QueryOptions;
import io.terraform.tfe.QueryValues;

import java.util.ArrayList;
import java.util.List;

public final class VariableSetReadOptions implements QueryOptions {

    private final List<VariableSetIncludeOpt> include = new ArrayList<>();

    public VariableSetReadOptions include(VariableSetIncludeOpt... relations) {
        include.addAll(List.of(relations));
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        values.addAll("include", include);
    }
}
