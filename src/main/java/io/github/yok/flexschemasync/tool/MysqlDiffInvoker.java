package io.github.yok.flexschemasync.tool;

import io.github.yok.flexschemasync.config.RunSettings;
import io.github.yok.flexschemasync.util.MaskingLogUtil;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link StructuralDiffer} that runs MySQL Utilities' {@code mysqldiff} once per table.
 *
 * <pre>
 * mysqldiff --server1=user[:password]@host:port --compact --difftype=sql live.table:tmp.table
 * </pre>
 *
 * <p>
 * {@code mysqldiff} exits with {@code 0} when the definitions are identical and with {@code 1}
 * when it printed differences, so both count as success. Anything else is a failure, and so are
 * exit code {@code 1} with nothing but error output and any {@code ERROR:} line on standard
 * output, where MySQL Utilities print their runtime errors.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MysqlDiffInvoker implements StructuralDiffer {

    static final int EXIT_IDENTICAL = 0;
    static final int EXIT_DIFFERENT = 1;
    static final String ERROR_PREFIX = "ERROR:";

    private final RunSettings settings;
    private final CommandRunner commandRunner;

    /**
     * Creates an invoker that starts real processes.
     *
     * @param settings run settings
     */
    public MysqlDiffInvoker(RunSettings settings) {
        this(settings, new ProcessCommandRunner());
    }

    /**
     * Creates an invoker with a custom command runner.
     *
     * @param settings run settings
     * @param commandRunner runner used to start {@code mysqldiff}
     */
    MysqlDiffInvoker(RunSettings settings, CommandRunner commandRunner) {
        this.settings = settings;
        this.commandRunner = commandRunner;
    }

    @Override
    public DiffResult diff(String tableName) {
        List<String> command = buildCommand(tableName);
        log.info("About to find the alter script for `{}.{} - {}.{}`", settings.getLiveDbName(),
                tableName, settings.getScratchDbName(), tableName);
        CommandResult result;
        try {
            result = commandRunner.run(command);
        } catch (IOException e) {
            log.error("Failed to run {}", MaskingLogUtil.maskCommand(command), e);
            return DiffResult.failure(tableName, "Cannot run " + settings.getDiffCommand() + ": "
                    + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DiffResult.failure(tableName, "Interrupted while waiting for "
                    + settings.getDiffCommand());
        }
        return interpret(tableName, result);
    }

    /**
     * Builds the {@code mysqldiff} command line for the given table.
     *
     * @param tableName table to compare
     * @return command and arguments
     */
    List<String> buildCommand(String tableName) {
        List<String> command = new ArrayList<>();
        command.add(settings.getDiffCommand());
        StringBuilder server = new StringBuilder("--server1=").append(settings.getUser());
        if (settings.hasPassword()) {
            server.append(':').append(settings.getPassword());
        }
        server.append('@').append(settings.getHost()).append(':').append(settings.getPort());
        command.add(server.toString());
        command.add("--compact");
        command.add("--difftype=sql");
        command.add(settings.getLiveDbName() + "." + tableName + ":" + settings.getScratchDbName()
                + "." + tableName);
        return command;
    }

    /**
     * Maps the exit code and output of {@code mysqldiff} to a {@link DiffResult}.
     *
     * @param tableName compared table
     * @param result command result
     * @return diff outcome
     */
    DiffResult interpret(String tableName, CommandResult result) {
        int exitCode = result.getExitCode();
        String stdout = StringUtils.defaultString(result.getStdout());
        String stderr = StringUtils.defaultString(result.getStderr());
        if (exitCode != EXIT_IDENTICAL && exitCode != EXIT_DIFFERENT) {
            return DiffResult.failure(tableName, settings.getDiffCommand() + " exited with "
                    + exitCode + ": " + StringUtils.trimToEmpty(stderr));
        }
        if (exitCode == EXIT_DIFFERENT && stdout.isBlank() && !stderr.isBlank()) {
            return DiffResult.failure(tableName, StringUtils.trimToEmpty(stderr));
        }
        String errorLine = findErrorLine(stdout);
        if (errorLine != null) {
            return DiffResult.failure(tableName, errorLine);
        }
        if (!stderr.isBlank()) {
            log.warn("{} wrote to stderr for table {}: {}", settings.getDiffCommand(), tableName,
                    StringUtils.trimToEmpty(stderr));
        }
        return DiffResult.success(tableName, stdout);
    }

    private static String findErrorLine(String stdout) {
        for (String line : stdout.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.startsWith(ERROR_PREFIX)) {
                return trimmed;
            }
        }
        return null;
    }
}
