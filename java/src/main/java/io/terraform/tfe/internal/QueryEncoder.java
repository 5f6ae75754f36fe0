package io.terraform.tfe.internal;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Encodes query parameters into {@code application/x-www-form-urlencoded} form, sorted by key.
 *
 * <p>
 * Behaves like a plain form encoder except for list-valued keys ({@code include} and any {@code filter[...]} key):
 * their values are joined with commas into a single pair instead of being repeated.
 * </p>
 */
public final class QueryEncoder {

    static final String INCLUDE_PARAM = "include";

    private QueryEncoder() {
    }

    public static String encode(Map<String, List<String>> values) {
        if (values == null || values.isEmpty()) {
            return "";
        }
        List<String> keys = new ArrayList<>(values.keySet());
        Collections.sort(keys);

        StringBuilder buf = new StringBuilder();
        for (String key : keys) {
            List<String> vs = values.get(key);
            if (vs == null) {
                continue;
            }
            if (vs.size() > 1 && isListKey(key)) {
                vs = List.of(String.join(",", vs));
            }
            String keyEscaped = escape(key);
            for (String v : vs) {
                if (buf.length() > 0) {
                    buf.append('&');
                }
                buf.append(keyEscaped).append('=').append(escape(v == null ? "" : v));
            }
        }
        return buf.toString();
    }

    static boolean isListKey(String key) {
        return INCLUDE_PARAM.equals(key) || key.contains("filter[");
    }

    /**
     * Escapes a single query component or path segment.
     */
    public static String escape(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
