package io.terraform.tfe.user;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiResource;

@JsonApiResource("users")
public final class User {

    @JsonApiId
    private String id;

    @JsonApiAttribute("username")
    private String username;

    @JsonApiAttribute("email")
    private String email;

    @JsonApiAttribute("avatar-url")
    private String avatarUrl;

    @JsonApiAttribute("is-service-account")
    private Boolean serviceAccount;

    @JsonApiAttribute("is-site-admin")
    private Boolean siteAdmin;

    @JsonApiAttribute("two-factor")
    private TwoFactor twoFactor;

    @JsonApiAttribute("unconfirmed-email")
    private String unconfirmedEmail;

    @JsonApiAttribute("v2-only")
    private Boolean v2Only;

    public User() {
    }

    public static User reference(String id) {
        User user = new User();
        user.id = id;
        return user;
    }

    public String getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getEmail() {
        return email;
    }

    public String getAvatarUrl() {
        return avatarUrl;
    }

    public boolean isServiceAccount() {
        return Boolean.TRUE.equals(serviceAccount);
    }

    public boolean isSiteAdmin() {
        return Boolean.TRUE.equals(siteAdmin);
    }

    public TwoFactor getTwoFactor() {
        return twoFactor;
    }

    /**
     * @return the pending address while an email change awaits confirmation.
     */
    public String getUnconfirmedEmail() {
        return unconfirmedEmail;
    }

    public boolean isV2Only() {
        return Boolean.TRUE.equals(v2Only);
    }
}
