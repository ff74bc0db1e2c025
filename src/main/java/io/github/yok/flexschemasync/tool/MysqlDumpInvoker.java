package io.github.yok.flexschemasync.tool;

import io.github.yok.flexschemasync.config.RunSettings;
import io.github.yok.flexschemasync.util.MaskingLogUtil;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link SchemaDumper} that runs {@code mysqldump --tab} without data, comments, DROP TABLE or
 * LOCK statements.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MysqlDumpInvoker implements SchemaDumper {

    static final List<String> DUMP_OPTIONS = List.of("--no-data", "--skip-comments",
            "--skip-add-drop-table", "--skip-add-locks");

    private final RunSettings settings;
    private final CommandRunner commandRunner;

    /**
     * Creates an invoker that starts real processes.
     *
     * @param settings run settings
     */
    public MysqlDumpInvoker(RunSettings settings) {
        this(settings, new ProcessCommandRunner());
    }

    /**
     * Creates an invoker with a custom command runner.
     *
     * @param settings run settings
     * @param commandRunner runner used to start {@code mysqldump}
     */
    MysqlDumpInvoker(RunSettings settings, CommandRunner commandRunner) {
        this.settings = settings;
        this.commandRunner = commandRunner;
    }

    @Override
    public CommandResult dump(Path targetDir) throws IOException, InterruptedException {
        List<String> command = buildCommand(targetDir);
        CommandResult result = commandRunner.run(command);
        log.info("Executed command\n\t{}", MaskingLogUtil.maskCommand(command));
        return result;
    }

    /**
     * Builds the {@code mysqldump} command line.
     *
     * @param targetDir directory passed to {@code --tab}
     * @return command and arguments
     */
    List<String> buildCommand(Path targetDir) {
        List<String> command = new ArrayList<>();
        command.add(settings.getDumpCommand());
        command.add("--host=" + settings.getHost());
        command.add("--port=" + settings.getPort());
        command.add("--user=" + settings.getUser());
        if (settings.hasPassword()) {
            command.add("--password=" + settings.getPassword());
        }
        command.add("--tab=" + targetDir.toString());
        command.add(settings.getLiveDbName());
        command.addAll(DUMP_OPTIONS);
        return command;
    }
}
