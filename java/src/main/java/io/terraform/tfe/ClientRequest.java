package io.terraform.tfe;

import io.terraform.tfe.internal.ErrorTranslator;
import io.terraform.tfe.internal.Json;
import io.terraform.tfe.internal.ResponseUnmarshaler;
import io.terraform.tfe.internal.RetryingTransport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * A prepared request. Headers may still be overridden before one of the terminal operations sends it; every terminal
 * operation translates non-success statuses into {@link TfeApiException}s.
 */
public final class ClientRequest {

    private static final Logger LOGGER = Logger.getLogger(ClientRequest.class.getName());

    private final RetryingTransport transport;
    private final String method;
    private final URI uri;
    private final byte[] body;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Duration timeout;

    ClientRequest(
        RetryingTransport transport,
        String method,
        URI uri,
        byte[] body,
        Map<String, String> headers,
        Duration timeout
    ) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.body = body;
        this.headers.putAll(headers);
        this.timeout = timeout;
    }

    /**
     * Sets or replaces a single header; a {@code null} value removes it.
     */
    public ClientRequest header(String name, String value) {
        if (value == null) {
            headers.remove(name);
        } else {
            headers.put(name, value);
        }
        return this;
    }

    public String getMethod() {
        return method;
    }

    public URI getUri() {
        return uri;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    /**
     * Sends the request and returns the successful response. The caller owns the body stream.
     */
    public HttpResponse<InputStream> send() throws TfeException {
        HttpResponse<InputStream> response = transport.send(toHttpRequest());
        LOGGER.fine(() -> "[tfe-sdk] " + method + " " + uri.getPath() + " -> " + response.statusCode());
        if (ErrorTranslator.isSuccess(response.statusCode())) {
            return response;
        }
        try (InputStream stream = response.body()) {
            throw ErrorTranslator.translate(response.statusCode(), stream);
        } catch (IOException ex) {
            throw new TfeException("read error response: " + ex.getMessage(), ex);
        }
    }

    /**
     * Sends the request and discards the response body.
     */
    public void execute() throws TfeException {
        try (InputStream stream = send().body()) {
            stream.transferTo(OutputStream.nullOutputStream());
        } catch (IOException ex) {
            throw new TfeException(method + " " + uri + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Decodes a JSON:API document holding a single resource.
     */
    public <T> T decode(Class<T> type) throws TfeException {
        try (InputStream stream = send().body()) {
            return ResponseUnmarshaler.decodeOne(stream, type);
        } catch (IOException ex) {
            throw new TfeException(method + " " + uri + ": " + ex.getMessage(), ex);
        }
    }

    public <T> ResourceList<T> decodeList(Class<T> type) throws TfeException {
        try (InputStream stream = send().body()) {
            return ResponseUnmarshaler.decodeList(stream, type);
        } catch (IOException ex) {
            throw new TfeException(method + " " + uri + ": " + ex.getMessage(), ex);
        }
    }

    public <T> NextPrevList<T> decodeNextPrevList(Class<T> type) throws TfeException {
        try (InputStream stream = send().body()) {
            return ResponseUnmarshaler.decodeNextPrevList(stream, type);
        } catch (IOException ex) {
            throw new TfeException(method + " " + uri + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Decodes a plain JSON response body.
     */
    public <T> T decodeJson(Class<T> type) throws TfeException {
        try (InputStream stream = send().body()) {
            return Json.mapper().readValue(stream, type);
        } catch (IOException ex) {
            throw new TfeException("decode " + type.getSimpleName() + " response: " + ex.getMessage(), ex);
        }
    }

    /**
     * Copies the raw response body into {@code out}.
     *
     * @return the number of bytes written.
     */
    public long writeTo(OutputStream out) throws TfeException {
        Objects.requireNonNull(out, "out");
        try (InputStream stream = send().body()) {
            return stream.transferTo(out);
        } catch (IOException ex) {
            throw new TfeException(method + " " + uri + ": " + ex.getMessage(), ex);
        }
    }

    HttpRequest toHttpRequest() {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri);
        if (timeout != null) {
            builder.timeout(timeout);
        }
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
        }
        headers.forEach(builder::header);
        return builder.build();
    }
}
