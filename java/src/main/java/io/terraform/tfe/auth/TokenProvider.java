package io.terraform.tfe.auth;

import io.terraform.tfe.TfeException;

import java.net.URI;

/**
 * Contract for obtaining the bearer token attached to a request.
 */
public interface TokenProvider {

    /**
     * @param target the URL the request is about to be sent to.
     * @return the token to send, or {@code null} when {@code target} must not receive credentials.
     */
    String token(URI target) throws TfeException;
}
