package io.terraform.tfe;

import java.net.http.HttpResponse;

/**
 * Observer invoked before each retry. It cannot influence whether the retry happens.
 */
@FunctionalInterface
public interface RetryLogHook {

    /**
     * @param attempt  zero-based index of the attempt being retried.
     * @param response the response that triggered the retry, or {@code null} after a transport failure.
     */
    void onRetry(int attempt, HttpResponse<?> response);
}
