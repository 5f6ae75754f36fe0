package io.terraform.tfe.runtask;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiResource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One detailed finding reported alongside a task result.
 */
@JsonApiResource("task-result-outcomes")
public final class TaskResultOutcome {

    @JsonApiAttribute("outcome-id")
    private String outcomeId;

    @JsonApiAttribute("description")
    private String description;

    @JsonApiAttribute("body")
    private String body;

    @JsonApiAttribute("url")
    private String url;

    @JsonApiAttribute("tags")
    private Map<String, List<TaskResultTag>> tags;

    public TaskResultOutcome outcomeId(String outcomeId) {
        this.outcomeId = outcomeId;
        return this;
    }

    public TaskResultOutcome description(String description) {
        this.description = description;
        return this;
    }

    /**
     * Markdown rendered in the run details.
     */
    public TaskResultOutcome body(String body) {
        this.body = body;
        return this;
    }

    public TaskResultOutcome url(String url) {
        this.url = url;
        return this;
    }

    public TaskResultOutcome tag(String column, TaskResultTag tag) {
        if (tags == null) {
            tags = new LinkedHashMap<>();
        }
        tags.computeIfAbsent(column, k -> new ArrayList<>()).add(tag);
        return this;
    }

    public String getOutcomeId() {
        return outcomeId;
    }

    public Map<String, List<TaskResultTag>> getTags() {
        return tags == null ? Map.of() : tags;
    }
}
