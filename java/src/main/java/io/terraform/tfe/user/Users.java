package io.terraform.tfe.user;

import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeException;

import java.util.Objects;

/**
 * Account endpoints for the user owning the API token.
 */
public final class Users {

    private final TfeClient client;

    public Users(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public User readCurrent() throws TfeException {
        return client.newRequest("GET", "account/details", null, null).decode(User.class);
    }

    public User updateCurrent(UserUpdateOptions options) throws TfeException {
        Objects.requireNonNull(options, "options");
        return client.newRequest("PATCH", "account/update", options, null).decode(User.class);
    }
}
