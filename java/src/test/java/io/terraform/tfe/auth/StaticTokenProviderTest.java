package io.terraform.tfe.auth;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StaticTokenProviderTest {

    @Test
    void handsTokenOnlyToAllowedHosts() {
        StaticTokenProvider provider = new StaticTokenProvider("secret", Set.of("app.terraform.io"));

        assertEquals("secret", provider.token(URI.create("https://app.terraform.io/api/v2/ping")));
        assertEquals("secret", provider.token(URI.create("https://APP.terraform.io/api/v2/ping")));
        assertNull(provider.token(URI.create("https://archivist.terraform.io/v1/object/abc")));
    }

    @Test
    void portIsPartOfTheAuthority() {
        StaticTokenProvider provider = new StaticTokenProvider("secret", Set.of("tfe.internal:8443"));

        assertEquals("secret", provider.token(URI.create("https://tfe.internal:8443/api/v2/ping")));
        assertNull(provider.token(URI.create("https://tfe.internal/api/v2/ping")));
    }

    @Test
    void emptyAllowListAcceptsAnyHost() {
        StaticTokenProvider provider = new StaticTokenProvider("secret", Set.of());

        assertEquals("secret", provider.token(URI.create("https://anywhere.example/path")));
        assertNull(provider.token(URI.create("relative/path")));
    }
}
