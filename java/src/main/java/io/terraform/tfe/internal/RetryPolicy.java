package io.terraform.tfe.internal;

import io.terraform.tfe.RetryLogHook;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether a completed attempt is retried and how long to wait before the next one.
 *
 * <p>
 * Rate-limited responses (429) are always retried, waiting at least as long as the server's
 * {@code X-RateLimit-Reset} hint. Transport failures and server errors (5xx) are retried only when server-error retries
 * are enabled, using a linear jitter backoff.
 * </p>
 */
public final class RetryPolicy {

    private static final Logger LOGGER = Logger.getLogger(RetryPolicy.class.getName());

    public static final String HEADER_RATE_RESET = "X-RateLimit-Reset";

    private final boolean retryServerErrors;
    private final int retryMax;
    private final Duration waitMin;
    private final Duration waitMax;
    private final Duration serverErrorWaitMin;
    private final Duration serverErrorWaitMax;
    private final RetryLogHook retryLogHook;
    private final DoubleSupplier jitter;

    public RetryPolicy(
        boolean retryServerErrors,
        int retryMax,
        Duration waitMin,
        Duration waitMax,
        Duration serverErrorWaitMin,
        Duration serverErrorWaitMax,
        RetryLogHook retryLogHook
    ) {
        this(retryServerErrors, retryMax, waitMin, waitMax, serverErrorWaitMin, serverErrorWaitMax, retryLogHook,
            () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryPolicy(
        boolean retryServerErrors,
        int retryMax,
        Duration waitMin,
        Duration waitMax,
        Duration serverErrorWaitMin,
        Duration serverErrorWaitMax,
        RetryLogHook retryLogHook,
        DoubleSupplier jitter
    ) {
        this.retryServerErrors = retryServerErrors;
        this.retryMax = Math.max(0, retryMax);
        this.waitMin = Objects.requireNonNull(waitMin, "waitMin");
        this.waitMax = Objects.requireNonNull(waitMax, "waitMax");
        this.serverErrorWaitMin = Objects.requireNonNull(serverErrorWaitMin, "serverErrorWaitMin");
        this.serverErrorWaitMax = Objects.requireNonNull(serverErrorWaitMax, "serverErrorWaitMax");
        this.retryLogHook = retryLogHook;
        this.jitter = Objects.requireNonNull(jitter, "jitter");
    }

    public int retryMax() {
        return retryMax;
    }

    public boolean retryServerErrors() {
        return retryServerErrors;
    }

    /**
     * @param response the response of the attempt, {@code null} when the transport failed.
     * @param failure  the transport failure, {@code null} when a response arrived.
     * @return whether to issue another attempt.
     * @throws TfeException with {@link TfeError#CANCELLED} when the calling thread has been interrupted.
     */
    public boolean shouldRetry(HttpResponse<?> response, IOException failure) throws TfeException {
        if (Thread.currentThread().isInterrupted()) {
            throw new TfeException(TfeError.CANCELLED, failure);
        }
        if (failure != null) {
            return retryServerErrors;
        }
        if (response == null) {
            return false;
        }
        int status = response.statusCode();
        return status == 429 || (retryServerErrors && status >= 500);
    }

    /**
     * Computes the wait before retry number {@code attempt + 1}, then notifies the retry hook.
     *
     * @param attempt  zero-based index of the attempt that just failed.
     * @param response its response, or {@code null} after a transport failure.
     */
    public Duration backoff(int attempt, HttpResponse<?> response) {
        Duration wait = response != null && response.statusCode() == 429
            ? rateLimitBackoff(response)
            : linearJitterBackoff(serverErrorWaitMin, serverErrorWaitMax, attempt);
        notifyHook(attempt, response);
        return wait;
    }

    /**
     * The hook only observes; whatever it throws is logged and the retry proceeds.
     */
    private void notifyHook(int attempt, HttpResponse<?> response) {
        if (retryLogHook == null) {
            return;
        }
        try {
            retryLogHook.onRetry(attempt, response);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, ex, () -> "[tfe-sdk] retry log hook failed on attempt " + attempt);
        }
    }

    /**
     * Waits until the rate limit window resets, plus jitter bounded by the min/max window so a crowd of clients does
     * not retry in lockstep. The reset hint only raises the floor; it never shortens the minimum wait.
     */
    Duration rateLimitBackoff(HttpResponse<?> response) {
        long minNanos = waitMin.toNanos();
        long jitterNanos = (long) (jitter.getAsDouble() * (waitMax.toNanos() - minNanos));

        Optional<String> header = response.headers().firstValue(HEADER_RATE_RESET);
        if (header.isPresent() && !header.get().isBlank()) {
            String raw = header.get().trim();
            try {
                double reset = Double.parseDouble(raw);
                if (!Double.isFinite(reset)) {
                    LOGGER.warning(() -> "[tfe-sdk] ignoring non-finite " + HEADER_RATE_RESET + " header: " + raw);
                } else if (reset > 0) {
                    // (long) saturates at Long.MAX_VALUE for very large hints.
                    minNanos = Math.max(minNanos, (long) (reset * 1e9));
                }
            } catch (NumberFormatException ex) {
                LOGGER.log(Level.WARNING, ex, () -> "[tfe-sdk] ignoring malformed " + HEADER_RATE_RESET + " header: " + raw);
            }
        }
        return Duration.ofNanos(saturatedAdd(minNanos, Math.max(0, jitterNanos)));
    }

    Duration linearJitterBackoff(Duration min, Duration max, int attempt) {
        long multiplier = attempt + 1L;
        long minNanos = min.toNanos();
        long maxNanos = max.toNanos();
        if (maxNanos <= minNanos) {
            return Duration.ofNanos(minNanos * multiplier);
        }
        long jittered = (long) (jitter.getAsDouble() * (maxNanos - minNanos)) + minNanos;
        return Duration.ofNanos(jittered > Long.MAX_VALUE / multiplier ? Long.MAX_VALUE : jittered * multiplier);
    }

    private static long saturatedAdd(long a, long b) {
        return a > Long.MAX_VALUE - b ? Long.MAX_VALUE : a + b;
    }
}
