package io.terraform.tfe.runtask;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;

import java.util.ArrayList;
import java.util.List;

@JsonApiResource("task-results")
public final class TaskResultCallbackOptions {

    @JsonApiAttribute("status")
    private TaskResultStatus status;

    @JsonApiAttribute("message")
    private String message;

    @JsonApiAttribute("url")
    private String url;

    @JsonApiRelation("outcomes")
    private List<TaskResultOutcome> outcomes;

    public TaskResultCallbackOptions status(TaskResultStatus status) {
        this.status = status;
        return this;
    }

    public TaskResultCallbackOptions message(String message) {
        this.message = message;
        return this;
    }

    /**
     * Link to the integration's own view of the result.
     */
    public TaskResultCallbackOptions url(String url) {
        this.url = url;
        return this;
    }

    public TaskResultCallbackOptions outcome(TaskResultOutcome outcome) {
        if (outcomes == null) {
            outcomes = new ArrayList<>();
        }
        outcomes.add(outcome);
        return this;
    }

    public TaskResultStatus getStatus() {
        return status;
    }
}
