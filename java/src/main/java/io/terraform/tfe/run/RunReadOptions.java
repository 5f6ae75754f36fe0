package io.terraform.tfe.run;

import io.terraform.tfe.QueryOptions;
import io.terraform.tfe.QueryValues;

import java.util.ArrayList;
import java.util.List;

public final class RunReadOptions implements QueryOptions {

    private final List<RunIncludeOpt> include = new ArrayList<>();

    public RunReadOptions include(RunIncludeOpt... relations) {
        include.addAll(List.of(relations));
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        values.addAll("include", include);
    }
}
