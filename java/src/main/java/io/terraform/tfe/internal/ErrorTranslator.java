package io.terraform.tfe.internal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.terraform.tfe.TfeApiException;
import io.terraform.tfe.TfeError;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Refines HTTP failures into {@link TfeApiException}s, using sentinels where callers are expected to branch.
 */
public final class ErrorTranslator {

    private static final ObjectMapper MAPPER = Json.mapper();
    private static final String INCLUDE_PARAMETER = "include parameter";

    private ErrorTranslator() {
    }

    record ErrorsPayload(List<ErrorObject> errors) {
    }

    record ErrorObject(
        @JsonProperty("status") String status,
        @JsonProperty("title") String title,
        @JsonProperty("detail") String detail
    ) {
    }

    public static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 400;
    }

    /**
     * Returns {@code null} when {@code statusCode} is a success, otherwise the exception describing the failure.
     * The body stream is consumed but not closed.
     */
    public static TfeApiException translate(int statusCode, InputStream body) {
        if (isSuccess(statusCode)) {
            return null;
        }
        switch (statusCode) {
            case 401:
                return new TfeApiException(statusCode, TfeError.UNAUTHORIZED);
            case 404:
                return new TfeApiException(statusCode, TfeError.RESOURCE_NOT_FOUND);
            default:
                break;
        }

        List<String> errors = decodeErrorPayload(body);
        if (errors.isEmpty()) {
            return new TfeApiException(statusCode, statusLine(statusCode));
        }
        if (statusCode == 400 && errors.stream().anyMatch(e -> e.contains(INCLUDE_PARAMETER))) {
            return new TfeApiException(statusCode, TfeError.INVALID_INCLUDE_VALUE);
        }
        return new TfeApiException(statusCode, errors);
    }

    static List<String> decodeErrorPayload(InputStream body) {
        if (body == null) {
            return List.of();
        }
        ErrorsPayload payload;
        try {
            byte[] bytes = body.readAllBytes();
            if (bytes.length == 0) {
                return List.of();
            }
            payload = MAPPER.readValue(bytes, ErrorsPayload.class);
        } catch (IOException ex) {
            return List.of();
        }
        if (payload == null || payload.errors() == null) {
            return List.of();
        }

        List<String> errors = new ArrayList<>(payload.errors().size());
        for (ErrorObject error : payload.errors()) {
            if (error == null) {
                continue;
            }
            String title = error.title() == null ? "" : error.title();
            if (error.detail() == null || error.detail().isEmpty()) {
                errors.add(title);
            } else {
                errors.add(title + "\n\n" + error.detail());
            }
        }
        return errors;
    }

    public static String statusLine(int statusCode) {
        String reason = switch (statusCode) {
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 405 -> "Method Not Allowed";
            case 409 -> "Conflict";
            case 412 -> "Precondition Failed";
            case 415 -> "Unsupported Media Type";
            case 422 -> "Unprocessable Entity";
            case 429 -> "Too Many Requests";
            case 500 -> "Internal Server Error";
            case 501 -> "Not Implemented";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "";
        };
        return reason.isEmpty() ? Integer.toString(statusCode) : statusCode + " " + reason;
    }
}
