package io.terraform.tfe.registry;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RegistryName {
    PRIVATE("private"),
    PUBLIC("public");

    private final String value;

    RegistryName(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
