package io.terraform.tfe.notification;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.user.User;

import java.util.List;

@JsonApiResource("notification-configurations")
public final class NotificationConfigurationUpdateOptions {

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

    public NotificationConfigurationUpdateOptions enabled(Boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public NotificationConfigurationUpdateOptions name(String name) {
        this.name = name;
        return this;
    }

    public NotificationConfigurationUpdateOptions token(String token) {
        this.token = token;
        return this;
    }

    public NotificationConfigurationUpdateOptions triggers(NotificationTrigger... triggers) {
        this.triggers = List.of(triggers);
        return this;
    }

    public NotificationConfigurationUpdateOptions url(String url) {
        this.url = url;
        return this;
    }

    public NotificationConfigurationUpdateOptions emailAddresses(String... emailAddresses) {
        this.emailAddresses = List.of(emailAddresses);
        return this;
    }

    public NotificationConfigurationUpdateOptions emailUsers(List<User> emailUsers) {
        this.emailUsers = emailUsers == null ? null : List.copyOf(emailUsers);
        return this;
    }

    String getName() {
        return name;
    }

    List<NotificationTrigger> getTriggers() {
        return triggers == null ? List.of() : triggers;
    }
}
