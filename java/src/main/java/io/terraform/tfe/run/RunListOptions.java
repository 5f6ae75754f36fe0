package io.terraform.tfe.run;

import io.terraform.tfe.ListOptions;
import io.terraform.tfe.QueryValues;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public final class RunListOptions extends ListOptions<RunListOptions> {

    private final List<RunStatus> statuses = new ArrayList<>();
    private String operation;
    private String source;
    private String user;
    private String commit;
    private String search;
    private final List<RunIncludeOpt> include = new ArrayList<>();

    /**
     * Only runs in one of these states. Sent as a single comma-separated filter.
     */
    public RunListOptions status(RunStatus... statuses) {
        this.statuses.addAll(List.of(statuses));
        return this;
    }

    /**
     * Comma-separated operations, for example {@code plan_only,plan_and_apply}.
     */
    public RunListOptions operation(String operation) {
        this.operation = operation;
        return this;
    }

    public RunListOptions source(String source) {
        this.source = source;
        return this;
    }

    public RunListOptions user(String user) {
        this.user = user;
        return this;
    }

    public RunListOptions commit(String commit) {
        this.commit = commit;
        return this;
    }

    /**
     * Matches run ID, commit SHA or user name.
     */
    public RunListOptions search(String search) {
        this.search = search;
        return this;
    }

    public RunListOptions include(RunIncludeOpt... relations) {
        include.addAll(List.of(relations));
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        super.appendTo(values);
        if (!statuses.isEmpty()) {
            values.add("filter[status]", statuses.stream().map(RunStatus::value).collect(Collectors.joining(",")));
        }
        values.add("filter[operation]", operation);
        values.add("filter[source]", source);
        values.add("search[user]", user);
        values.add("search[commit]", commit);
        values.add("search[basic]", search);
        values.addAll("include", include);
    }

    @Override
    protected RunListOptions self() {
        return this;
    }
}
