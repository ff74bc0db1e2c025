package io.github.yok.flexschemasync.tool;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes one schema file per live table into a directory.
 */
public interface SchemaDumper {

    /**
     * Dumps the live schema.
     *
     * @param targetDir existing directory receiving the files
     * @return result of the dump command
     * @throws IOException if the dump command cannot be started
     * @throws InterruptedException if interrupted while waiting for the command
     */
    CommandResult dump(Path targetDir) throws IOException, InterruptedException;
}
