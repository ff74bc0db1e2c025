package io.github.yok.flexschemasync.model;

import java.nio.file.Path;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of writing and executing a push script.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ApplyResult {

    /**
     * File the script was written to, or {@code null} if writing failed.
     */
    private final Path exportedTo;

    /**
     * Whether the script was sent to the live database.
     */
    private final boolean executed;

    /**
     * Error message of a failed execution, or {@code null}.
     */
    private final String executionError;

    /**
     * Returns whether applying ended without an execution error. A dry run or an empty script
     * counts as succeeded.
     *
     * @return {@code true} when no execution error occurred
     */
    public boolean isSucceeded() {
        return executionError == null;
    }
}
