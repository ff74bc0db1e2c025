package io.github.yok.flexschemasync.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports conditions that end a push or pull early.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the message (and the stack trace of the cause) through SLF4J.</li>
 * <li>Echoes a one-line summary to {@code System.err} so the operator sees it next to the tool's
 * console output.</li>
 * <li>Never terminates the JVM: every run still reaches its scratch-database cleanup and ends
 * normally.</li>
 * <li>Tests can make it throw {@link IllegalStateException} for the current thread instead.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> THROW_ON_ERROR =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {}

    /**
     * Makes {@link #errorAndExit} throw for the current thread (for tests).
     */
    public static void disableExitForCurrentThread() {
        THROW_ON_ERROR.set(Boolean.TRUE);
    }

    /**
     * Restores reporting-only behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        THROW_ON_ERROR.remove();
    }

    /**
     * Reports a fatal condition together with its cause.
     *
     * @param message what was being attempted
     * @param cause root cause
     * @throws IllegalStateException only when throwing was enabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(THROW_ON_ERROR.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + " (" + ExceptionUtils.getRootCauseMessage(cause)
                + ")");
    }

    /**
     * Reports a fatal condition without an underlying exception.
     *
     * @param message description of the condition
     * @throws IllegalStateException only when throwing was enabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(THROW_ON_ERROR.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
