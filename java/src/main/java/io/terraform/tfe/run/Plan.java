package io.terraform.tfe.run;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiResource;

@JsonApiResource("plans")
public final class Plan {

    @JsonApiId
    private String id;

    @JsonApiAttribute("has-changes")
    private Boolean hasChanges;

    @JsonApiAttribute("log-read-url")
    private String logReadUrl;

    @JsonApiAttribute("resource-additions")
    private Integer resourceAdditions;

    @JsonApiAttribute("resource-changes")
    private Integer resourceChanges;

    @JsonApiAttribute("resource-destructions")
    private Integer resourceDestructions;

    @JsonApiAttribute("resource-imports")
    private Integer resourceImports;

    @JsonApiAttribute("status")
    private PlanStatus status;

    @JsonApiAttribute("status-timestamps")
    private PlanStatusTimestamps statusTimestamps;

    public Plan() {
    }

    public String getId() {
        return id;
    }

    public boolean hasChanges() {
        return Boolean.TRUE.equals(hasChanges);
    }

    /**
     * @return a short-lived URL the log can be fetched from without credentials.
     */
    public String getLogReadUrl() {
        return logReadUrl;
    }

    public int getResourceAdditions() {
        return resourceAdditions == null ? 0 : resourceAdditions;
    }

    public int getResourceChanges() {
        return resourceChanges == null ? 0 : resourceChanges;
    }

    public int getResourceDestructions() {
        return resourceDestructions == null ? 0 : resourceDestructions;
    }

    public int getResourceImports() {
        return resourceImports == null ? 0 : resourceImports;
    }

    public PlanStatus getStatus() {
        return status;
    }

    public PlanStatusTimestamps getStatusTimestamps() {
        return statusTimestamps;
    }
}
