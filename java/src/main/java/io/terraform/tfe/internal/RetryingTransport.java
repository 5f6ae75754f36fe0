package io.terraform.tfe.internal;

import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends requests through the shared {@link HttpClient}, gating each attempt on the client's {@link RateLimiter} and
 * retrying according to its {@link RetryPolicy}.
 *
 * <p>
 * Once retries are exhausted the last response is handed back untouched so the caller can translate it; the last
 * transport failure is wrapped into a {@link TfeException}.
 * </p>
 */
public final class RetryingTransport {

    private static final Logger LOGGER = Logger.getLogger(RetryingTransport.class.getName());

    private final HttpClient httpClient;
    private final RetryPolicy policy;
    private final RateLimiter limiter;
    private final Sleeper sleeper;

    public RetryingTransport(HttpClient httpClient, RetryPolicy policy, RateLimiter limiter, Sleeper sleeper) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public HttpResponse<InputStream> send(HttpRequest request) throws TfeException {
        for (int attempt = 0; ; attempt++) {
            acquirePermit();

            HttpResponse<InputStream> response = null;
            IOException failure = null;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            } catch (IOException ex) {
                failure = ex;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new TfeException(TfeError.CANCELLED, ex);
            }

            boolean retry;
            try {
                retry = policy.shouldRetry(response, failure);
            } catch (TfeException ex) {
                discard(response);
                throw ex;
            }
            if (!retry || attempt >= policy.retryMax()) {
                if (failure != null) {
                    throw new TfeException(describe(request) + ": " + failure.getMessage(), failure);
                }
                return response;
            }

            Duration wait = policy.backoff(attempt, response);
            discard(response);
            int attemptNumber = attempt + 1;
            String cause = failure != null ? failure.toString() : "HTTP " + response.statusCode();
            LOGGER.info(() -> String.format(Locale.ROOT, "[tfe-sdk] %s failed (%s), retry %d/%d in %d ms",
                describe(request), cause, attemptNumber, policy.retryMax(), wait.toMillis()));

            try {
                sleeper.sleep(wait);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new TfeException(TfeError.CANCELLED, ex);
            }
        }
    }

    public RateLimiter limiter() {
        return limiter;
    }

    private void acquirePermit() throws TfeException {
        try {
            limiter.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TfeException(TfeError.CANCELLED, ex);
        }
    }

    /**
     * Drains and closes a response body so the underlying connection can be reused.
     */
    private static void discard(HttpResponse<InputStream> response) {
        if (response == null || response.body() == null) {
            return;
        }
        try (InputStream body = response.body()) {
            body.transferTo(OutputStream.nullOutputStream());
        } catch (IOException ex) {
            LOGGER.log(Level.FINE, ex, () -> "[tfe-sdk] failed to drain response body before retry");
        }
    }

    private static String describe(HttpRequest request) {
        return request.method() + " " + request.uri();
    }
}
