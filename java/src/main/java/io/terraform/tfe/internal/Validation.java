package io.terraform.tfe.internal;

import java.util.regex.Pattern;

/**
 * Local checks applied to identifiers and names before a request is built.
 */
public final class Validation {

    private static final Pattern RESOURCE_ID = Pattern.compile("^[a-zA-Z0-9\\-._]+$");

    private Validation() {
    }

    /**
     * @return whether {@code value} is present and non-empty.
     */
    public static boolean validString(String value) {
        return value != null && !value.isEmpty();
    }

    /**
     * @return whether {@code value} is usable as a path segment identifier: letters, digits, {@code -}, {@code .} and
     * {@code _} only.
     */
    public static boolean validStringId(String value) {
        return value != null && RESOURCE_ID.matcher(value).matches();
    }
}
