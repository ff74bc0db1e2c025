package io.github.yok.flexschemasync.config;

import java.util.Locale;

/**
 * Direction of a run.
 *
 * @author Yasuharu.Okawauchi
 */
public enum SyncDirection {

    /** Apply the schema files to the live database. */
    PUSH,

    /** Export the live schema into schema files. */
    PULL;

    /**
     * Resolves the direction from its command-line spelling ({@code push} or {@code pull}).
     *
     * @param value command-line value, case-insensitive
     * @return resolved direction
     * @throws IllegalArgumentException if the value is neither {@code push} nor {@code pull}
     */
    public static SyncDirection fromArgument(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            if ("push".equals(normalized)) {
                return PUSH;
            }
            if ("pull".equals(normalized)) {
                return PULL;
            }
        }
        throw new IllegalArgumentException(
                "Direction must be `push` or `pull` but was: " + value);
    }
}
