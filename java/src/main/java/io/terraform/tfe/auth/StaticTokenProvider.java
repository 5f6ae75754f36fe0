package io.terraform.tfe.auth;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hands out a fixed API token, but only to the hosts it was issued for.
 */
public final class StaticTokenProvider implements TokenProvider {

    private final String token;
    private final Set<String> allowedHosts;

    public StaticTokenProvider(String token, Set<String> allowedHosts) {
        this.token = Objects.requireNonNull(token, "token");
        this.allowedHosts = Objects.requireNonNull(allowedHosts, "allowedHosts").stream()
            .map(host -> host.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String token(URI target) {
        if (target == null || target.getHost() == null) {
            return null;
        }
        if (!allowedHosts.isEmpty() && !allowedHosts.contains(authority(target))) {
            return null;
        }
        return token;
    }

    public Set<String> getAllowedHosts() {
        return allowedHosts;
    }

    static String authority(URI uri) {
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return uri.getPort() == -1 ? host : host + ":" + uri.getPort();
    }
}
