package io.terraform.tfe.notification;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.user.User;

import java.util.List;

@JsonApiResource("notification-configurations")
public final class NotificationConfigurationCreateOptions {

    @JsonApiAttribute("destination-type")
    private NotificationDestinationType destinationType;

    @JsonApiAttribute("enabled")
    private Boolean enabled;

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("token")
    private String token;

    @JsonApiAttribute("triggers")
    private List<NotificationTrigger> triggers;

    @JsonApiAttribute("url")
    private String url;

    @JsonApiAttribute("email-addresses")
    private List<String> emailAddresses;

    @JsonApiRelation("users")
    private List<User> emailUsers;

    public NotificationConfigurationCreateOptions destinationType(NotificationDestinationType destinationType) {
        this.destinationType = destinationType;
        return this;
    }

    public NotificationConfigurationCreateOptions enabled(Boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public NotificationConfigurationCreateOptions name(String name) {
        this.name = name;
        return this;
    }

    /**
     * Secret used to sign generic webhook payloads.
     */
    public NotificationConfigurationCreateOptions token(String token) {
        this.token = token;
        return this;
    }

    public NotificationConfigurationCreateOptions triggers(NotificationTrigger... triggers) {
        this.triggers = List.of(triggers);
        return this;
    }

    public NotificationConfigurationCreateOptions url(String url) {
        this.url = url;
        return this;
    }

    public NotificationConfigurationCreateOptions emailAddresses(String... emailAddresses) {
        this.emailAddresses = List.of(emailAddresses);
        return this;
    }

    public NotificationConfigurationCreateOptions emailUsers(List<User> emailUsers) {
        this.emailUsers = emailUsers == null ? null : List.copyOf(emailUsers);
        return this;
    }

    NotificationDestinationType getDestinationType() {
        return destinationType;
    }

    Boolean getEnabled() {
        return enabled;
    }

    String getName() {
        return name;
    }

    List<NotificationTrigger> getTriggers() {
        return triggers == null ? List.of() : triggers;
    }

    String getUrl() {
        return url;
    }
}
