package io.terraform.tfe.run;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.workspace.Workspace;

import java.time.Instant;
import java.util.List;

@JsonApiResource("runs")
public final class Run {

    @JsonApiId
    private String id;

    @JsonApiAttribute("status")
    private RunStatus status;

    @JsonApiAttribute("message")
    private String message;

    @JsonApiAttribute("source")
    private RunSource source;

    @JsonApiAttribute("created-at")
    private Instant createdAt;

    @JsonApiAttribute("is-destroy")
    private Boolean destroy;

    @JsonApiAttribute("has-changes")
    private Boolean hasChanges;

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

    @JsonApiAttribute("actions")
    private RunActions actions;

    @JsonApiAttribute("permissions")
    private RunPermissions permissions;

    @JsonApiAttribute("status-timestamps")
    private RunStatusTimestamps statusTimestamps;

    @JsonApiRelation("workspace")
    private Workspace workspace;

    @JsonApiRelation("plan")
    private Plan plan;

    @JsonApiRelation("apply")
    private Apply apply;

    public Run() {
    }

    public static Run reference(String id) {
        Run run = new Run();
        run.id = id;
        return run;
    }

    public String getId() {
        return id;
    }

    public RunStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public RunSource getSource() {
        return source;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isDestroy() {
        return Boolean.TRUE.equals(destroy);
    }

    public boolean hasChanges() {
        return Boolean.TRUE.equals(hasChanges);
    }

    public boolean isAutoApply() {
        return Boolean.TRUE.equals(autoApply);
    }

    /**
     * @return whether the run is speculative and can never be applied.
     */
    public boolean isPlanOnly() {
        return Boolean.TRUE.equals(planOnly);
    }

    public boolean isRefresh() {
        return Boolean.TRUE.equals(refresh);
    }

    public boolean isRefreshOnly() {
        return Boolean.TRUE.equals(refreshOnly);
    }

    public List<String> getTargetAddrs() {
        return targetAddrs == null ? List.of() : targetAddrs;
    }

    public List<String> getReplaceAddrs() {
        return replaceAddrs == null ? List.of() : replaceAddrs;
    }

    public String getTerraformVersion() {
        return terraformVersion;
    }

    public RunActions getActions() {
        return actions;
    }

    public RunPermissions getPermissions() {
        return permissions;
    }

    public RunStatusTimestamps getStatusTimestamps() {
        return statusTimestamps;
    }

    public Workspace getWorkspace() {
        return workspace;
    }

    public Plan getPlan() {
        return plan;
    }

    public Apply getApply() {
        return apply;
    }
}
