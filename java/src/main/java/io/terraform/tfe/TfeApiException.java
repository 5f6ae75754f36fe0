package io.terraform.tfe;

import java.util.List;

/**
 * Exception representing an error returned by the remote API. When the server responds with a status outside
 * [200, 400) the SDK hydrates this type so callers can inspect both the HTTP status and the individual error
 * messages decoded from the JSON:API {@code errors} array.
 */
public final class TfeApiException extends TfeException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final List<String> messages;

    public TfeApiException(int statusCode, TfeError error) {
        super(error, error.message());
        this.statusCode = statusCode;
        this.messages = List.of();
    }

    public TfeApiException(int statusCode, List<String> messages) {
        super(null, String.join("\n", messages));
        this.statusCode = statusCode;
        this.messages = List.copyOf(messages);
    }

    public TfeApiException(int statusCode, String statusLine) {
        super(null, statusLine);
        this.statusCode = statusCode;
        this.messages = List.of();
    }

    /**
     * @return HTTP status code returned by the API.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the rendered error entries (title, or title and detail), empty for sentinels and status-line fallbacks.
     */
    public List<String> getMessages() {
        return messages;
    }
}
