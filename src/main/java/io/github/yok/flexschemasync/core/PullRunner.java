package io.github.yok.flexschemasync.core;

import io.github.yok.flexschemasync.config.RunSettings;
import io.github.yok.flexschemasync.tool.CommandResult;
import io.github.yok.flexschemasync.tool.MysqlDumpInvoker;
import io.github.yok.flexschemasync.tool.SchemaDumper;
import io.github.yok.flexschemasync.util.ErrorHandler;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Runs a pull: regenerates the schema directory from the live database.
 *
 * <p>
 * Existing schema files are deleted first so tables dropped from the live database disappear
 * from the directory too. Other files are left alone.
 * </p>
 *
 * <p>
 * {@code mysqldump --tab} writes the files from the MySQL server process, so the directory must be
 * writable by the server and the server must run on the same host.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PullRunner {

    private final RunSettings settings;
    private final SchemaDumper dumper;

    /**
     * Creates a runner using {@code mysqldump}.
     *
     * @param settings run settings
     */
    public PullRunner(RunSettings settings) {
        this(settings, new MysqlDumpInvoker(settings));
    }

    /**
     * Creates a runner with a custom dumper.
     *
     * @param settings run settings
     * @param dumper schema dump collaborator
     */
    PullRunner(RunSettings settings, SchemaDumper dumper) {
        this.settings = settings;
        this.dumper = dumper;
    }

    /**
     * Runs the pull.
     *
     * @return {@code true} if the dump completed
     */
    public boolean execute() {
        Path dir = settings.getSchemaDir();
        log.info("=== Pull started (live={}, tab={}) ===", settings.getLiveDbName(), dir);
        try {
            Files.createDirectories(dir);
            int deleted = deleteSchemaFiles(dir);
            log.info("Just deleted {} `*{}` files.", deleted, settings.getSchemaFileSuffix());

            CommandResult result = dumper.dump(dir);
            if (result.getExitCode() != 0) {
                ErrorHandler.errorAndExit(settings.getDumpCommand() + " exited with "
                        + result.getExitCode() + ": " + StringUtils.trimToEmpty(result.getStderr()));
                return false;
            }
            log.info("=== Pull finished ===");
            return true;
        } catch (IOException e) {
            ErrorHandler.errorAndExit("Pull failed for directory " + dir, e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ErrorHandler.errorAndExit("Pull interrupted", e);
            return false;
        }
    }

    /**
     * Deletes the schema files (regular files with the schema-file suffix) of a directory.
     *
     * @param dir schema directory
     * @return number of deleted files
     * @throws IOException if listing or deleting fails
     */
    int deleteSchemaFiles(Path dir) throws IOException {
        List<Path> targets;
        try (Stream<Path> stream = Files.list(dir)) {
            targets = stream.filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                    .filter(p -> p.getFileName().toString()
                            .endsWith(settings.getSchemaFileSuffix()))
                    .collect(Collectors.toList());
        }
        for (Path target : targets) {
            Files.delete(target);
            log.debug("Deleted {}", target);
        }
        return targets.size();
    }
}
