package io.terraform.tfe;

/**
 * Tells a {@link LogReader} whether the operation producing the log has finished.
 */
@FunctionalInterface
public interface LogCompletion {

    boolean isDone() throws TfeException;
}
