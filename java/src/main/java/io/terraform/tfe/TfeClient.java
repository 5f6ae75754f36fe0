package io.terraform.tfe;

import io.terraform.tfe.admin.AdminGeneralSettings;
import io.terraform.tfe.agentpool.AgentPools;
import io.terraform.tfe.audittrail.AuditTrails;
import io.terraform.tfe.auth.TokenProvider;
import io.terraform.tfe.internal.BodySerializer;
import io.terraform.tfe.internal.ErrorTranslator;
import io.terraform.tfe.internal.QueryEncoder;
import io.terraform.tfe.internal.RateLimiter;
import io.terraform.tfe.internal.RetryPolicy;
import io.terraform.tfe.internal.RetryingTransport;
import io.terraform.tfe.internal.Sleeper;
import io.terraform.tfe.meta.Meta;
import io.terraform.tfe.notification.NotificationConfigurations;
import io.terraform.tfe.organization.Organizations;
import io.terraform.tfe.project.Projects;
import io.terraform.tfe.registry.RegistryProviders;
import io.terraform.tfe.run.Applies;
import io.terraform.tfe.run.Plans;
import io.terraform.tfe.run.Runs;
import io.terraform.tfe.runtask.RunTaskCallbacks;
import io.terraform.tfe.stack.Stacks;
import io.terraform.tfe.team.Teams;
import io.terraform.tfe.user.Users;
import io.terraform.tfe.variableset.VariableSets;
import io.terraform.tfe.workspace.Workspaces;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * <p>
 * Entry point for the HCP Terraform and Terraform Enterprise API. The client is thread-safe: create one instance per
 * organization token, optionally call {@link #init()} during startup so the server's rate limit is honoured from the
 * first request, and reuse it for the lifetime of the JVM.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Every request passes through a client-wide rate limiter, configured from the {@code X-RateLimit-Limit} header
 *       the {@code ping} endpoint reports.</li>
 *   <li>Rate-limited responses (429) are retried after the server's reset hint. Server errors and transport failures are
 *       retried only when {@link Config.Builder#retryServerErrors(boolean)} is enabled.</li>
 *   <li>Failures surface as {@link TfeException}; HTTP failures as {@link TfeApiException} carrying the status code and
 *       a {@link TfeError} sentinel where callers are expected to branch.</li>
 * </ul>
 */
public final class TfeClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(TfeClient.class.getName());

    static final String HEADER_RATE_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_API_VERSION = "TFP-API-Version";
    static final String HEADER_TFE_VERSION = "X-TFE-Version";
    static final String HEADER_APP_NAME = "TFP-AppName";

    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final Config config;
    private final URI baseUrl;
    private final URI registryBaseUrl;
    private final TokenProvider tokenProvider;
    private final RateLimiter limiter;
    private final RetryingTransport transport;
    private final Sleeper sleeper;

    private final Object initLock = new Object();
    private boolean initAttempted;
    private TfeException initFailure;
    private volatile RemoteMetadata remoteMetadata;

    private final Organizations organizations = new Organizations(this);
    private final Workspaces workspaces = new Workspaces(this);
    private final Projects projects = new Projects(this);
    private final Teams teams = new Teams(this);
    private final Users users = new Users(this);
    private final AgentPools agentPools = new AgentPools(this);
    private final VariableSets variableSets = new VariableSets(this);
    private final NotificationConfigurations notificationConfigurations = new NotificationConfigurations(this);
    private final Runs runs = new Runs(this);
    private final Plans plans = new Plans(this);
    private final Applies applies = new Applies(this);
    private final RegistryProviders registryProviders = new RegistryProviders(this);
    private final Stacks stacks = new Stacks(this);
    private final RunTaskCallbacks runTaskCallback = new RunTaskCallbacks(this);
    private final AdminGeneralSettings adminGeneralSettings = new AdminGeneralSettings(this);
    private final AuditTrails auditTrails = new AuditTrails(this);
    private final Meta meta = new Meta(this);

    /**
     * Constructs a new client using the supplied configuration.
     *
     * @param config caller-supplied configuration; only the API token is mandatory. The constructor captures a copy
     *               with defaults applied, so subsequent mutations to the builder will not influence this client.
     */
    public TfeClient(Config config) {
        this(config, Sleeper.SYSTEM);
    }

    TfeClient(Config config, Sleeper sleeper) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.baseUrl = this.config.getBaseUrl();
        this.registryBaseUrl = this.config.getRegistryBaseUrl();
        this.tokenProvider = this.config.getTokenProvider();
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.limiter = new RateLimiter();
        RetryPolicy policy = new RetryPolicy(
            this.config.isRetryServerErrors(),
            this.config.getRetryMax(),
            this.config.getRetryWaitMin(),
            this.config.getRetryWaitMax(),
            this.config.getServerErrorWaitMin(),
            this.config.getServerErrorWaitMax(),
            this.config.getRetryLogHook()
        );
        this.transport = new RetryingTransport(this.config.getHttpClient(), policy, limiter, sleeper);
    }

    /**
     * Eagerly initialises the client by pinging the API and applying its rate limit.
     *
     * <p>
     * The call is idempotent: multiple threads can safely invoke {@code init()} and only the first execution performs
     * the remote call. If the ping fails, the exception is memoised and rethrown for each subsequent attempt so that
     * callers have a consistent failure mode.
     * </p>
     *
     * @throws TfeException when the API cannot be reached or rejects the token.
     */
    public void init() throws TfeException {
        synchronized (initLock) {
            if (initAttempted) {
                if (initFailure != null) {
                    throw initFailure;
                }
                return;
            }
            initAttempted = true;
            try {
                ping();
            } catch (TfeException ex) {
                initFailure = ex;
                throw ex;
            }
        }
    }

    /**
     * Calls the {@code ping} endpoint, configures the rate limiter from its headers and returns the server metadata.
     */
    public RemoteMetadata ping() throws TfeException {
        HttpResponse<InputStream> response = newRequest("GET", "ping", null, null).send();
        try (InputStream body = response.body()) {
            body.transferTo(OutputStream.nullOutputStream());
        } catch (IOException ex) {
            throw new TfeException("read ping response: " + ex.getMessage(), ex);
        }

        RemoteMetadata metadata = new RemoteMetadata(
            header(response, HEADER_API_VERSION),
            header(response, HEADER_TFE_VERSION),
            header(response, HEADER_APP_NAME),
            header(response, HEADER_RATE_LIMIT)
        );
        configureLimiter(metadata.rateLimit());
        remoteMetadata = metadata;
        LOGGER.info(() -> String.format(Locale.ROOT, "[tfe-sdk] connected to %s (api %s, rate limit %s)",
            config.getAddress(),
            metadata.apiVersion().isEmpty() ? "unknown" : metadata.apiVersion(),
            metadata.rateLimit().isEmpty() ? "none" : metadata.rateLimit()));
        return metadata;
    }

    /**
     * Applies a raw {@code X-RateLimit-Limit} value to the client's limiter. Blank or invalid values remove the limit.
     */
    public void configureLimiter(String rawLimit) {
        limiter.configure(rawLimit);
    }

    /**
     * @return the metadata reported by the last successful {@link #ping()}, or {@code null} before the first one.
     */
    public RemoteMetadata getRemoteMetadata() {
        return remoteMetadata;
    }

    /**
     * Builds a JSON:API request relative to the API base URL.
     *
     * @param method HTTP method.
     * @param path   path relative to the base URL, or an absolute URL used as-is.
     * @param body   request payload, serialized for {@code POST}, {@code PUT}, {@code PATCH} and {@code DELETE} only.
     * @param query  query parameters, may be {@code null}.
     */
    public ClientRequest newRequest(String method, String path, Object body, QueryOptions query) throws TfeException {
        return buildRequest(baseUrl, method, path, body, query, BodySerializer.CONTENT_TYPE_JSONAPI);
    }

    /**
     * Builds a request where {@code value} is the query for {@code GET} and the body for every other method.
     */
    public ClientRequest newRequest(String method, String path, Object value) throws TfeException {
        if ("GET".equals(method)) {
            if (value != null && !(value instanceof QueryOptions)) {
                throw new TfeException("GET request options must implement QueryOptions, got "
                    + value.getClass().getName());
            }
            return newRequest(method, path, null, (QueryOptions) value);
        }
        return newRequest(method, path, value, null);
    }

    /**
     * Same as {@link #newRequest(String, String, Object, QueryOptions)} for endpoints that answer with plain JSON.
     */
    public ClientRequest newJsonRequest(String method, String path, Object body, QueryOptions query) throws TfeException {
        return buildRequest(baseUrl, method, path, body, query, BodySerializer.CONTENT_TYPE_JSON);
    }

    /**
     * Builds a JSON:API request relative to the private registry base URL.
     */
    public ClientRequest newRegistryRequest(String method, String path, Object body, QueryOptions query)
        throws TfeException {
        return buildRequest(registryBaseUrl, method, path, body, query, BodySerializer.CONTENT_TYPE_JSONAPI);
    }

    /**
     * Uploads {@code data} to a foreign URL, such as a configuration version upload URL. No credentials are sent and no
     * response body is decoded.
     */
    public void uploadObject(String url, InputStream data) throws TfeException {
        Objects.requireNonNull(data, "data");
        if (url == null || url.isBlank()) {
            throw new TfeException(TfeError.INVALID_URL);
        }
        URI target;
        try {
            target = new URI(url);
        } catch (URISyntaxException ex) {
            throw new TfeException(TfeError.INVALID_URL, ex);
        }
        if (target.getScheme() == null || target.getHost() == null) {
            throw new TfeException(TfeError.INVALID_URL);
        }

        Map<String, String> headers = defaultHeaders();
        headers.put("Accept", "application/json, */*");
        headers.put("Content-Type", "application/octet-stream");
        byte[] payload;
        try {
            payload = data.readAllBytes();
        } catch (IOException ex) {
            throw new TfeException("read upload data: " + ex.getMessage(), ex);
        }
        // Retried attempts resend these bytes.
        HttpRequest.Builder builder = HttpRequest.newBuilder(target)
            .timeout(config.getHttpTimeout())
            .PUT(HttpRequest.BodyPublishers.ofByteArray(payload));
        headers.forEach(builder::header);

        HttpResponse<InputStream> response = transport.send(builder.build());
        try (InputStream body = response.body()) {
            TfeApiException failure = ErrorTranslator.translate(response.statusCode(), body);
            if (failure != null) {
                throw failure;
            }
        } catch (IOException ex) {
            throw new TfeException("upload object: " + ex.getMessage(), ex);
        }
    }

    /**
     * Opens a reader over a plan or apply log.
     *
     * @param logUrl     the log read URL reported by the plan or apply.
     * @param completion consulted when the log stops growing, to decide whether it has ended.
     */
    public LogReader newLogReader(URI logUrl, LogCompletion completion) {
        return new LogReader(this, logUrl, completion, sleeper);
    }

    public Organizations organizations() {
        return organizations;
    }

    public Workspaces workspaces() {
        return workspaces;
    }

    public Projects projects() {
        return projects;
    }

    public Teams teams() {
        return teams;
    }

    public Users users() {
        return users;
    }

    public AgentPools agentPools() {
        return agentPools;
    }

    public VariableSets variableSets() {
        return variableSets;
    }

    public NotificationConfigurations notificationConfigurations() {
        return notificationConfigurations;
    }

    public Runs runs() {
        return runs;
    }

    public Plans plans() {
        return plans;
    }

    public Applies applies() {
        return applies;
    }

    public RegistryProviders registryProviders() {
        return registryProviders;
    }

    public Stacks stacks() {
        return stacks;
    }

    public RunTaskCallbacks runTaskCallback() {
        return runTaskCallback;
    }

    public AdminGeneralSettings adminGeneralSettings() {
        return adminGeneralSettings;
    }

    public AuditTrails auditTrails() {
        return auditTrails;
    }

    public Meta meta() {
        return meta;
    }

    public Config getConfig() {
        return config;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    public URI getRegistryBaseUrl() {
        return registryBaseUrl;
    }

    /**
     * Closes the client. Currently a no-op because the underlying {@link java.net.http.HttpClient} does not require
     * explicit shutdown and may be shared with the caller.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    /**
     * Log polls carry the client's default headers only.
     */
    ClientRequest newLogRequest(URI chunkUrl) {
        return new ClientRequest(transport, "GET", chunkUrl, null, defaultHeaders(), config.getHttpTimeout());
    }

    RateLimiter limiter() {
        return limiter;
    }

    private ClientRequest buildRequest(
        URI base,
        String method,
        String path,
        Object body,
        QueryOptions query,
        String accept
    ) throws TfeException {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        String verb = method.toUpperCase(Locale.ROOT);

        URI target = resolve(base, path, query);

        BodySerializer.SerializedBody payload = null;
        if (body != null && BODY_METHODS.contains(verb)) {
            payload = BodySerializer.serialize(body);
        }

        Map<String, String> headers = defaultHeaders();
        String token = tokenProvider.token(target);
        if (token != null && !token.isEmpty()) {
            headers.put("Authorization", "Bearer " + token);
        }
        headers.put("Accept", accept);
        if (payload != null) {
            headers.put("Content-Type", payload.contentType());
        }

        return new ClientRequest(transport, verb, target, payload == null ? null : payload.bytes(), headers,
            config.getHttpTimeout());
    }

    private static URI resolve(URI base, String path, QueryOptions query) throws TfeException {
        URI target;
        try {
            URI candidate = new URI(path);
            target = candidate.isAbsolute() ? candidate : base.resolve(candidate);
        } catch (URISyntaxException ex) {
            throw new TfeException("invalid request path " + path + ": " + ex.getMessage(), ex);
        }
        if (query == null) {
            return target;
        }
        String encoded = QueryEncoder.encode(query.toQueryValues().asMap());
        if (encoded.isEmpty()) {
            return target;
        }
        String raw = target.toString();
        return URI.create(raw + (target.getRawQuery() == null ? "?" : "&") + encoded);
    }

    private Map<String, String> defaultHeaders() {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(config.getHeaders());
        return headers;
    }

    private static String header(HttpResponse<?> response, String name) {
        return response.headers().firstValue(name).orElse("");
    }
}
