package io.terraform.tfe.variableset;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiResource;

@JsonApiResource("varsets")
public final class VariableSetUpdateOptions {

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("description")
    private String description;

    @JsonApiAttribute("global")
    private Boolean global;

    @JsonApiAttribute("priority")
    private Boolean priority;

    public VariableSetUpdateOptions name(String name) {
        this.name = name;
        return this;
    }

    public VariableSetUpdateOptions description(String description) {
        this.description = description;
        return this;
    }

    public VariableSetUpdateOptions global(Boolean global) {
        this.global = global;
        return this;
    }

    public VariableSetUpdateOptions priority(Boolean priority) {
        this.priority = priority;
        return this;
    }

    public String getName() {
        return name;
    }

    public Boolean getGlobal() {
        return global;
    }
}
