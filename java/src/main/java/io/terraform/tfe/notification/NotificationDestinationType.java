package io.terraform.tfe.notification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationDestinationType {
    EMAIL("email"),
    GENERIC("generic"),
    SLACK("slack"),
    MICROSOFT_TEAMS("microsoft-teams");

    private final String value;

    NotificationDestinationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Destinations that deliver to a webhook and therefore need a URL.
     */
    boolean requiresUrl() {
        return this != EMAIL;
    }

    @Override
    public String toString() {
        return value;
    }
}
