package io.github.yok.flexschemasync.model;

/**
 * Final state of a push run.
 *
 * @author Yasuharu.Okawauchi
 */
public enum PushStatus {

    /** The script was executed against the live database. */
    APPLIED,

    /** The script was written but not executed. */
    DRY_RUN,

    /** The script was written, but executing it failed. */
    EXECUTION_FAILED,

    /** A fatal error stopped the run before the script was applied. */
    ABORTED
}
