package io.terraform.tfe.meta;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * CIDR ranges the platform connects from or accepts connections on, grouped by purpose.
 */
public record IPRange(
    @JsonProperty("api") List<String> api,
    @JsonProperty("notifications") List<String> notifications,
    @JsonProperty("sentinel") List<String> sentinel,
    @JsonProperty("vcs") List<String> vcs
) {

    public static final IPRange EMPTY = new IPRange(List.of(), List.of(), List.of(), List.of());

    public IPRange {
        api = api == null ? List.of() : api;
        notifications = notifications == null ? List.of() : notifications;
        sentinel = sentinel == null ? List.of() : sentinel;
        vcs = vcs == null ? List.of() : vcs;
    }
}
