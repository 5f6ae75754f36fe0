package io.terraform.tfe.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Available versions of a provider as reported by the registry protocol.
 */
public record ProviderVersions(
    @JsonProperty("id") String id,
    @JsonProperty("versions") List<Version> versions,
    @JsonProperty("warnings") List<String> warnings
) {

    public ProviderVersions {
        versions = versions == null ? List.of() : versions;
        warnings = warnings == null ? List.of() : warnings;
    }

    public record Version(
        @JsonProperty("version") String version,
        @JsonProperty("protocols") List<String> protocols,
        @JsonProperty("platforms") List<Platform> platforms
    ) {
    }

    public record Platform(@JsonProperty("os") String os, @JsonProperty("arch") String arch) {
    }
}
