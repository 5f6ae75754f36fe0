package io.terraform.tfe.notification;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.user.User;
import io.terraform.tfe.workspace.Workspace;

import java.time.Instant;
import java.util.List;

@JsonApiResource("notification-configurations")
public final class NotificationConfiguration {

    @JsonApiId
    private String id;

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("enabled")
    private Boolean enabled;

    @JsonApiAttribute("destination-type")
    private NotificationDestinationType destinationType;

    @JsonApiAttribute("url")
    private String url;

    @JsonApiAttribute("triggers")
    private List<String> triggers;

    @JsonApiAttribute("email-addresses")
    private List<String> emailAddresses;

    @JsonApiAttribute("created-at")
    private Instant createdAt;

    @JsonApiAttribute("updated-at")
    private Instant updatedAt;

    @JsonApiAttribute("delivery-responses")
    private List<DeliveryResponse> deliveryResponses;

    @JsonApiRelation("subscribable")
    private Workspace subscribable;

    @JsonApiRelation("users")
    private List<User> emailUsers;

    public NotificationConfiguration() {
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public NotificationDestinationType getDestinationType() {
        return destinationType;
    }

    public String getUrl() {
        return url;
    }

    /**
     * Trigger values are kept as sent by the server so that newer triggers survive decoding.
     */
    public List<String> getTriggers() {
        return triggers == null ? List.of() : triggers;
    }

    public List<String> getEmailAddresses() {
        return emailAddresses == null ? List.of() : emailAddresses;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public List<DeliveryResponse> getDeliveryResponses() {
        return deliveryResponses == null ? List.of() : deliveryResponses;
    }

    public Workspace getSubscribable() {
        return subscribable;
    }

    public List<User> getEmailUsers() {
        return emailUsers == null ? List.of() : emailUsers;
    }
}
