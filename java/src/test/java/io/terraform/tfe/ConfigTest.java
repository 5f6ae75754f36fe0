package io.terraform.tfe;

import io.terraform.tfe.auth.StaticTokenProvider;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() {
        Config config = Config.builder()
            .token("abc")
            .build();

        assertEquals(Config.DEFAULT_ADDRESS, config.getAddress());
        assertEquals(Config.DEFAULT_BASE_PATH, config.getBasePath());
        assertEquals(URI.create("https://app.terraform.io/api/v2/"), config.getBaseUrl());
        assertEquals(URI.create("https://app.terraform.io/api/registry/"), config.getRegistryBaseUrl());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
        assertEquals(Config.DEFAULT_RETRY_MAX, config.getRetryMax());
        assertEquals(Config.DEFAULT_RETRY_WAIT_MIN, config.getRetryWaitMin());
        assertEquals(Config.DEFAULT_RETRY_WAIT_MAX, config.getRetryWaitMax());
        assertFalse(config.isRetryServerErrors());
        assertEquals(Config.DEFAULT_USER_AGENT, config.getHeaders().get("User-Agent"));
        assertNotNull(config.getHttpClient());
        assertNull(config.getRetryLogHook());
    }

    @Test
    void staticTokenIsScopedToTheConfiguredAddress() {
        Config config = Config.builder()
            .address("https://tfe.example.com:8443/")
            .token("abc")
            .build();

        assertEquals("https://tfe.example.com:8443", config.getAddress());
        StaticTokenProvider provider = assertInstanceOf(StaticTokenProvider.class, config.getTokenProvider());
        assertEquals(Set.of("tfe.example.com:8443"), provider.getAllowedHosts());
    }

    @Test
    void normalisesBasePaths() {
        Config config = Config.builder()
            .token("abc")
            .basePath("custom/v2")
            .registryBasePath("  ")
            .build();

        assertEquals("/custom/v2/", config.getBasePath());
        assertEquals(Config.DEFAULT_REGISTRY_BASE_PATH, config.getRegistryBasePath());
    }

    @Test
    void requiresTokenUnlessProviderIsSupplied() {
        assertThrows(IllegalArgumentException.class, () -> Config.builder().build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().token(" ").build());

        Config config = Config.builder().tokenProvider(target -> "dynamic").build();
        assertNull(config.getToken());
    }

    @Test
    void rejectsInvalidAddress() {
        Config.Builder builder = Config.builder()
            .address("not a url")
            .token("abc");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsInvalidRetrySettings() {
        assertThrows(IllegalArgumentException.class,
            () -> Config.builder().token("abc").retryMax(-1).build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder()
            .token("abc")
            .retryWaitMin(Duration.ofSeconds(2))
            .retryWaitMax(Duration.ofSeconds(1))
            .build());
    }

    @Test
    void honoursCustomSettings() {
        Config config = Config.builder()
            .token("abc")
            .httpTimeout(Duration.ofSeconds(5))
            .retryServerErrors(true)
            .retryMax(3)
            .header("X-Trace", "on")
            .header("User-Agent", "custom-agent")
            .build();

        assertEquals(Duration.ofSeconds(5), config.getHttpTimeout());
        assertTrue(config.isRetryServerErrors());
        assertEquals(3, config.getRetryMax());
        assertEquals("on", config.getHeaders().get("X-Trace"));
        assertEquals("custom-agent", config.getHeaders().get("User-Agent"));
    }

    @Test
    void nonPositiveTimeoutFallsBackToDefault() {
        Config config = Config.builder()
            .token("abc")
            .httpTimeout(Duration.ZERO)
            .build();

        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
    }
}
