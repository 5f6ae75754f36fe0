package io.terraform.tfe;

import io.terraform.tfe.auth.StaticTokenProvider;
import io.terraform.tfe.auth.TokenProvider;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable configuration container used to bootstrap {@link TfeClient} instances.
 */
public final class Config {

    public static final String DEFAULT_ADDRESS = "https://app.terraform.io";
    public static final String DEFAULT_BASE_PATH = "/api/v2/";
    public static final String DEFAULT_REGISTRY_BASE_PATH = "/api/registry/";
    public static final String DEFAULT_USER_AGENT = "tfe-java-sdk";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_RETRY_MAX = 30;
    public static final Duration DEFAULT_RETRY_WAIT_MIN = Duration.ofMillis(100);
    public static final Duration DEFAULT_RETRY_WAIT_MAX = Duration.ofMillis(400);
    public static final Duration DEFAULT_SERVER_ERROR_WAIT_MIN = Duration.ofMillis(700);
    public static final Duration DEFAULT_SERVER_ERROR_WAIT_MAX = Duration.ofMillis(900);

    private final String address;
    private final String basePath;
    private final String registryBasePath;
    private final String token;
    private final Map<String, String> headers;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final boolean retryServerErrors;
    private final Integer retryMax;
    private final Duration retryWaitMin;
    private final Duration retryWaitMax;
    private final Duration serverErrorWaitMin;
    private final Duration serverErrorWaitMax;
    private final RetryLogHook retryLogHook;
    private final TokenProvider tokenProvider;

    private Config(Builder builder) {
        this.address = builder.address;
        this.basePath = builder.basePath;
        this.registryBasePath = builder.registryBasePath;
        this.token = builder.token;
        this.headers = builder.headers == null ? null : new LinkedHashMap<>(builder.headers);
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.retryServerErrors = builder.retryServerErrors;
        this.retryMax = builder.retryMax;
        this.retryWaitMin = builder.retryWaitMin;
        this.retryWaitMax = builder.retryWaitMax;
        this.serverErrorWaitMin = builder.serverErrorWaitMin;
        this.serverErrorWaitMax = builder.serverErrorWaitMax;
        this.retryLogHook = builder.retryLogHook;
        this.tokenProvider = builder.tokenProvider;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedAddress = sanitizeUrl(Optional.ofNullable(address).filter(s -> !s.isBlank()).orElse(DEFAULT_ADDRESS));
        String resolvedBasePath = sanitizePath(Optional.ofNullable(basePath).orElse(DEFAULT_BASE_PATH), DEFAULT_BASE_PATH);
        String resolvedRegistryPath = sanitizePath(
            Optional.ofNullable(registryBasePath).orElse(DEFAULT_REGISTRY_BASE_PATH), DEFAULT_REGISTRY_BASE_PATH);

        if (tokenProvider == null && (token == null || token.isBlank())) {
            throw new IllegalArgumentException("missing API token");
        }

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        int resolvedRetryMax = Optional.ofNullable(retryMax).orElse(DEFAULT_RETRY_MAX);
        if (resolvedRetryMax < 0) {
            throw new IllegalArgumentException("RetryMax cannot be negative");
        }

        Duration resolvedWaitMin = positiveOrDefault(retryWaitMin, DEFAULT_RETRY_WAIT_MIN);
        Duration resolvedWaitMax = positiveOrDefault(retryWaitMax, DEFAULT_RETRY_WAIT_MAX);
        if (resolvedWaitMax.compareTo(resolvedWaitMin) < 0) {
            throw new IllegalArgumentException("RetryWaitMax must not be shorter than RetryWaitMin");
        }
        Duration resolvedServerMin = positiveOrDefault(serverErrorWaitMin, DEFAULT_SERVER_ERROR_WAIT_MIN);
        Duration resolvedServerMax = positiveOrDefault(serverErrorWaitMax, DEFAULT_SERVER_ERROR_WAIT_MAX);
        if (resolvedServerMax.compareTo(resolvedServerMin) < 0) {
            throw new IllegalArgumentException("ServerErrorWaitMax must not be shorter than ServerErrorWaitMin");
        }

        Map<String, String> resolvedHeaders = new LinkedHashMap<>();
        resolvedHeaders.put("User-Agent", DEFAULT_USER_AGENT);
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && !name.isBlank() && value != null) {
                    resolvedHeaders.put(name.trim(), value);
                }
            });
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        }

        TokenProvider resolvedProvider = tokenProvider;
        if (resolvedProvider == null) {
            resolvedProvider = new StaticTokenProvider(token, Set.of(authority(resolvedAddress)));
        }

        return new Builder()
            .address(resolvedAddress)
            .basePath(resolvedBasePath)
            .registryBasePath(resolvedRegistryPath)
            .token(token)
            .headers(resolvedHeaders)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .retryServerErrors(retryServerErrors)
            .retryMax(resolvedRetryMax)
            .retryWaitMin(resolvedWaitMin)
            .retryWaitMax(resolvedWaitMax)
            .serverErrorWaitMin(resolvedServerMin)
            .serverErrorWaitMax(resolvedServerMax)
            .retryLogHook(retryLogHook)
            .tokenProvider(resolvedProvider)
            .buildInternal();
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback) {
        if (value == null || value.isNegative() || value.isZero()) {
            return fallback;
        }
        return value;
    }

    private static String sanitizeUrl(String url) {
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("invalid address: URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("invalid address: " + trimmed, ex);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String sanitizePath(String path, String fallback) {
        String trimmed = path.trim();
        if (trimmed.isEmpty()) {
            return fallback;
        }
        if (!trimmed.startsWith("/")) {
            trimmed = "/" + trimmed;
        }
        if (!trimmed.endsWith("/")) {
            trimmed = trimmed + "/";
        }
        return trimmed;
    }

    private static String authority(String url) {
        URI uri = URI.create(url);
        String host = uri.getHost();
        return uri.getPort() == -1 ? host : host + ":" + uri.getPort();
    }

    public String getAddress() {
        return address;
    }

    public String getBasePath() {
        return basePath;
    }

    public String getRegistryBasePath() {
        return registryBasePath;
    }

    /**
     * @return {@code address + basePath}, the URL resource paths resolve against.
     */
    public URI getBaseUrl() {
        return URI.create(address + basePath);
    }

    public URI getRegistryBaseUrl() {
        return URI.create(address + registryBasePath);
    }

    public String getToken() {
        return token;
    }

    public Map<String, String> getHeaders() {
        return headers == null ? Map.of() : Collections.unmodifiableMap(headers);
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public boolean isRetryServerErrors() {
        return retryServerErrors;
    }

    public int getRetryMax() {
        return retryMax == null ? DEFAULT_RETRY_MAX : retryMax;
    }

    public Duration getRetryWaitMin() {
        return retryWaitMin;
    }

    public Duration getRetryWaitMax() {
        return retryWaitMax;
    }

    public Duration getServerErrorWaitMin() {
        return serverErrorWaitMin;
    }

    public Duration getServerErrorWaitMax() {
        return serverErrorWaitMax;
    }

    public RetryLogHook getRetryLogHook() {
        return retryLogHook;
    }

    public TokenProvider getTokenProvider() {
        return tokenProvider;
    }

    public static final class Builder {
        private String address;
        private String basePath;
        private String registryBasePath;
        private String token;
        private Map<String, String> headers;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private boolean retryServerErrors;
        private Integer retryMax;
        private Duration retryWaitMin;
        private Duration retryWaitMax;
        private Duration serverErrorWaitMin;
        private Duration serverErrorWaitMax;
        private RetryLogHook retryLogHook;
        private TokenProvider tokenProvider;

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder basePath(String basePath) {
            this.basePath = basePath;
            return this;
        }

        public Builder registryBasePath(String registryBasePath) {
            this.registryBasePath = registryBasePath;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers == null ? null : new LinkedHashMap<>(headers);
            return this;
        }

        public Builder header(String name, String value) {
            if (this.headers == null) {
                this.headers = new LinkedHashMap<>();
            }
            this.headers.put(name, value);
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder retryServerErrors(boolean retryServerErrors) {
            this.retryServerErrors = retryServerErrors;
            return this;
        }

        public Builder retryMax(int retryMax) {
            this.retryMax = retryMax;
            return this;
        }

        public Builder retryWaitMin(Duration retryWaitMin) {
            this.retryWaitMin = retryWaitMin;
            return this;
        }

        public Builder retryWaitMax(Duration retryWaitMax) {
            this.retryWaitMax = retryWaitMax;
            return this;
        }

        public Builder serverErrorWaitMin(Duration serverErrorWaitMin) {
            this.serverErrorWaitMin = serverErrorWaitMin;
            return this;
        }

        public Builder serverErrorWaitMax(Duration serverErrorWaitMax) {
            this.serverErrorWaitMax = serverErrorWaitMax;
            return this;
        }

        public Builder retryLogHook(RetryLogHook retryLogHook) {
            this.retryLogHook = retryLogHook;
            return this;
        }

        public Builder tokenProvider(TokenProvider tokenProvider) {
            this.tokenProvider = tokenProvider;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
