package io.terraform.tfe.meta;

import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeException;
import io.terraform.tfe.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpResponse;
import java.util.Objects;

public final class IPRanges {

    private static final int NOT_MODIFIED = 304;

    private final TfeClient client;

    public IPRanges(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Reads the current ranges.
     *
     * @param modifiedSince an HTTP date for {@code If-Modified-Since}; blank to always fetch.
     * @return the ranges, or {@link IPRange#EMPTY} when they did not change since {@code modifiedSince}.
     */
    public IPRange read(String modifiedSince) throws TfeException {
        URI base = client.getBaseUrl();
        String url = base.getScheme() + "://" + base.getRawAuthority() + "/api/meta/ip-ranges";
        HttpResponse<InputStream> response = client.newJsonRequest("GET", url, null, null)
            .header("Accept", "application/json, */*")
            .header("If-Modified-Since", modifiedSince == null || modifiedSince.isBlank() ? null : modifiedSince)
            .send();
        try (InputStream body = response.body()) {
            if (response.statusCode() == NOT_MODIFIED) {
                body.transferTo(OutputStream.nullOutputStream());
                return IPRange.EMPTY;
            }
            return Json.mapper().readValue(body, IPRange.class);
        } catch (IOException ex) {
            throw new TfeException("decode IP ranges: " + ex.getMessage(), ex);
        }
    }
}
