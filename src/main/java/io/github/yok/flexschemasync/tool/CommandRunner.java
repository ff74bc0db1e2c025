package io.github.yok.flexschemasync.tool;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command to completion.
 */
public interface CommandRunner {

    /**
     * Starts the command, waits for it to exit and returns what it wrote.
     *
     * @param command executable followed by its arguments; no shell is involved
     * @return exit code, standard output and standard error
     * @throws IOException if the command cannot be started or its output cannot be read
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    CommandResult run(List<String> command) throws IOException, InterruptedException;
}
