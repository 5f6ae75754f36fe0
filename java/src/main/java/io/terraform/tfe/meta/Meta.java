package io.terraform.tfe.meta;

import io.terraform.tfe.TfeClient;

import java.util.Objects;

/**
 * Endpoints served outside the versioned API.
 */
public final class Meta {

    private final IPRanges ipRanges;

    public Meta(TfeClient client) {
        this.ipRanges = new IPRanges(Objects.requireNonNull(client, "client"));
    }

    public IPRanges ipRanges() {
        return ipRanges;
    }
}
