package io.terraform.tfe.agentpool;

import io.terraform.tfe.QueryOptions;
import io.terraform.tfe.QueryValues;

import java.util.ArrayList;
import java.util.List;

public final class AgentPoolReadOptions implements QueryOptions {

    private final List<AgentPoolIncludeOpt> include = new ArrayList<>();

    public AgentPoolReadOptions include(AgentPoolIncludeOpt... relations) {
        include.addAll(List.of(relations));
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        values.addAll("include", include);
    }
}
