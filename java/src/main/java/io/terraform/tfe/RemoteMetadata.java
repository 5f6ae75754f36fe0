package io.terraform.tfe;

/**
 * Server facts reported by the {@code ping} endpoint.
 *
 * @param apiVersion value of {@code TFP-API-Version}, empty when absent.
 * @param tfeVersion value of {@code X-TFE-Version}, empty on HCP Terraform.
 * @param appName    value of {@code TFP-AppName}.
 * @param rateLimit  raw {@code X-RateLimit-Limit}, empty when the server does not limit requests.
 */
public record RemoteMetadata(String apiVersion, String tfeVersion, String appName, String rateLimit) {

    public boolean isEnterprise() {
        return tfeVersion != null && !tfeVersion.isEmpty();
    }
}
