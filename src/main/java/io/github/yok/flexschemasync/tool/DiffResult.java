package io.github.yok.flexschemasync.tool;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one structural diff: either the ALTER script (possibly empty) or the reason it could
 * not be computed.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
@ToString
public class DiffResult {

    private final String tableName;

    private final boolean success;

    /**
     * ALTER script on success; empty on failure.
     */
    private final String output;

    /**
     * Failure description; {@code null} on success.
     */
    private final String failureReason;

    /**
     * Creates a successful result.
     *
     * @param tableName compared table
     * @param output script printed by the diff tool; {@code null} is treated as empty
     * @return successful result
     */
    public static DiffResult success(String tableName, String output) {
        return new DiffResult(tableName, true, output == null ? "" : output, null);
    }

    /**
     * Creates a failed result.
     *
     * @param tableName compared table
     * @param failureReason what went wrong
     * @return failed result
     */
    public static DiffResult failure(String tableName, String failureReason) {
        return new DiffResult(tableName, false, "", failureReason);
    }
}
