package io.github.yok.flexschemasync.config;

/**
 * Decides what a push does when the structural diff of a table cannot be computed.
 *
 * @author Yasuharu.Okawauchi
 */
public enum DiffFailurePolicy {

    /**
     * Abort the push before anything is applied to the live database.
     */
    ABORT,

    /**
     * Log a warning and contribute an empty fragment for the table.
     */
    SKIP
}
