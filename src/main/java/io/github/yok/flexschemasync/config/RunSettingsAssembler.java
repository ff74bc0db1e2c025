package io.github.yok.flexschemasync.config;

import static com.google.common.base.Preconditions.checkArgument;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Assembles the immutable {@link RunSettings} of a run from the configuration beans and the
 * command-line overrides.
 *
 * <p>
 * Command-line values win over {@code application.yml}. This is the only place where the mutable
 * configuration beans are read; everything downstream receives {@link RunSettings}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@RequiredArgsConstructor
public class RunSettingsAssembler {

    static final DateTimeFormatter EXPORT_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss");

    private final ConnectionConfig connectionConfig;
    private final PathsConfig pathsConfig;
    private final PushConfig pushConfig;
    private final PullConfig pullConfig;

    /**
     * Builds the settings using the current time for the default export path.
     *
     * @param options parsed command-line options
     * @return settings of the run
     * @throws IllegalArgumentException if a required value is missing or malformed
     */
    public RunSettings assemble(CommandLineOptions options) {
        return assemble(options, LocalDateTime.now());
    }

    /**
     * Builds the settings.
     *
     * @param options parsed command-line options
     * @param now timestamp used in the default push-script export file name
     * @return settings of the run
     * @throws IllegalArgumentException if a required value is missing or malformed
     */
    public RunSettings assemble(CommandLineOptions options, LocalDateTime now) {
        String liveDbName =
                StringUtils.defaultIfBlank(options.getLiveDbName(), connectionConfig.getLiveDbName());
        checkArgument(StringUtils.isNotBlank(liveDbName), "Live database name is required.");

        SyncDirection direction = SyncDirection.fromArgument(options.getDirection());

        String tab = StringUtils.defaultIfBlank(options.getTab(), pathsConfig.getTab());
        checkArgument(StringUtils.isNotBlank(tab), "Schema file directory (--tab) is required.");

        checkArgument(pushConfig.getDiffParallelism() >= 1,
                "push.diff-parallelism must be at least 1 but was %s",
                pushConfig.getDiffParallelism());
        checkArgument(StringUtils.isNotBlank(pushConfig.getScratchDbName()),
                "push.scratch-db-name is required.");
        checkArgument(!pushConfig.getScratchDbName().equalsIgnoreCase(liveDbName),
                "Scratch database must differ from the live database: %s", liveDbName);

        return RunSettings.builder()
                .direction(direction)
                .host(StringUtils.defaultIfBlank(options.getHost(), connectionConfig.getHost()))
                .port(resolvePort(options.getPort()))
                .user(StringUtils.defaultIfBlank(options.getUser(), connectionConfig.getUser()))
                .password(options.getPassword() != null ? options.getPassword()
                        : connectionConfig.getPassword())
                .liveDbName(liveDbName)
                .urlOptions(StringUtils.defaultString(connectionConfig.getUrlOptions()))
                .schemaDir(Paths.get(tab).toAbsolutePath().normalize())
                .schemaFileSuffix(pushConfig.getSchemaFileSuffix())
                .pushScriptExportPath(resolveExportPath(options.getPushScriptExportPath(), now))
                .dryRunPush(options.getDryRunPush() != null ? options.getDryRunPush()
                        : pushConfig.isDryRun())
                .retainsScratch(options.getRetainsTmp() != null ? options.getRetainsTmp()
                        : pushConfig.isRetainsTmp())
                .scratchDbName(pushConfig.getScratchDbName())
                .diffCommand(pushConfig.getDiffCommand())
                .diffFailurePolicy(pushConfig.getDiffFailurePolicy())
                .diffParallelism(pushConfig.getDiffParallelism())
                .dumpCommand(pullConfig.getDumpCommand())
                .build();
    }

    private int resolvePort(String cliPort) {
        if (StringUtils.isBlank(cliPort)) {
            return connectionConfig.getPort();
        }
        checkArgument(StringUtils.isNumeric(cliPort.trim()), "Port must be numeric: %s", cliPort);
        return Integer.parseInt(cliPort.trim());
    }

    private Path resolveExportPath(String cliPath, LocalDateTime now) {
        String configured =
                StringUtils.defaultIfBlank(cliPath, pathsConfig.getPushScriptExportPath());
        if (StringUtils.isNotBlank(configured)) {
            return Paths.get(configured).toAbsolutePath().normalize();
        }
        return Paths.get("push_script_" + EXPORT_TIMESTAMP.format(now) + ".sql").toAbsolutePath()
                .normalize();
    }
}
