package io.terraform.tfe.notification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * The outcome of one delivery attempt, as recorded by the server.
 */
public record DeliveryResponse(
    @JsonProperty("body") String body,
    @JsonProperty("code") String code,
    @JsonProperty("headers") Map<String, List<String>> headers,
    @JsonProperty("sent-at") String sentAt,
    @JsonProperty("successful") String successful,
    @JsonProperty("url") String url
) {
}
