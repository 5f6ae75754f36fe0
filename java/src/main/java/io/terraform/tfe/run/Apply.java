package io.terraform.tfe.run;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiResource;

@JsonApiResource("applies")
public final class Apply {

    @JsonApiId
    private String id;

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
    private ApplyStatus status;

    @JsonApiAttribute("status-timestamps")
    private ApplyStatusTimestamps statusTimestamps;

    public Apply() {
    }

    public String getId() {
        return id;
    }

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

    public ApplyStatus getStatus() {
        return status;
    }

    public ApplyStatusTimestamps getStatusTimestamps() {
        return statusTimestamps;
    }
}
