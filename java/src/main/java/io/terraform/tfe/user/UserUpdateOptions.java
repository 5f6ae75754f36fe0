package io.terraform.tfe.user;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiResource;

@JsonApiResource("users")
public final class UserUpdateOptions {

    @JsonApiAttribute("username")
    private String username;

    @JsonApiAttribute("email")
    private String email;

    public UserUpdateOptions username(String username) {
        this.username = username;
        return this;
    }

    /**
     * A new address stays unconfirmed until the user follows the confirmation link.
     */
    public UserUpdateOptions email(String email) {
        this.email = email;
        return this;
    }
}
