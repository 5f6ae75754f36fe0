package io.terraform.tfe.run;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.workspace.Workspace;

import java.util.List;

@JsonApiResource("runs")
public final class RunCreateOptions {

    @JsonApiAttribute("is-destroy")
    private Boolean destroy;

    @JsonApiAttribute("message")
    private String message;

    @JsonApiAttribute("auto-apply")
    private Boolean autoApply;

    @JsonApiAttribute("plan-only")
    private Boolean planOnly;

    @JsonApiAttribute("refresh")
    private Boolean refresh;

    @JsonApiAttribute("refresh-only")
    private Boolean refreshOnly;

    @JsonApiAttribute("target-addrs")
    private List<String> targetAddrs;

    @JsonApiAttribute("replace-addrs")
    private List<String> replaceAddrs;

    @JsonApiAttribute("terraform-version")
    private String terraformVersion;

    @JsonApiRelation("workspace")
    private Workspace workspace;

    public RunCreateOptions workspace(Workspace workspace) {
        this.workspace = workspace;
        return this;
    }

    public RunCreateOptions destroy(Boolean destroy) {
        this.destroy = destroy;
        return this;
    }

    public RunCreateOptions message(String message) {
        this.message = message;
        return this;
    }

    public RunCreateOptions autoApply(Boolean autoApply) {
        this.autoApply = autoApply;
        return this;
    }

    public RunCreateOptions planOnly(Boolean planOnly) {
        this.planOnly = planOnly;
        return this;
    }

    public RunCreateOptions refresh(Boolean refresh) {
        this.refresh = refresh;
        return this;
    }

    public RunCreateOptions refreshOnly(Boolean refreshOnly) {
        this.refreshOnly = refreshOnly;
        return this;
    }

    /**
     * Limits planning to these resource addresses and their dependencies.
     */
    public RunCreateOptions targetAddrs(String... targetAddrs) {
        this.targetAddrs = List.of(targetAddrs);
        return this;
    }

    public RunCreateOptions replaceAddrs(String... replaceAddrs) {
        this.replaceAddrs = List.of(replaceAddrs);
        return this;
    }

    /**
     * Only honoured for plan-only runs.
     */
    public RunCreateOptions terraformVersion(String terraformVersion) {
        this.terraformVersion = terraformVersion;
        return this;
    }

    public Workspace getWorkspace() {
        return workspace;
    }
}
