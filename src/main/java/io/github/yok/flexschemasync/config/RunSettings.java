package io.github.yok.flexschemasync.config;

import java.nio.file.Path;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable settings of one run, assembled once from {@code application.yml} and the command line
 * by {@link RunSettingsAssembler} and handed to every component explicitly.
 *
 * <p>
 * The password is excluded from {@link #toString()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@Builder
@ToString
public class RunSettings {

    private final SyncDirection direction;

    private final String host;

    private final int port;

    private final String user;

    @ToString.Exclude
    private final String password;

    private final String liveDbName;

    private final String urlOptions;

    /**
     * Directory holding one schema file per table.
     */
    private final Path schemaDir;

    private final String schemaFileSuffix;

    private final Path pushScriptExportPath;

    private final boolean dryRunPush;

    /**
     * Keep the scratch database once the push has finished.
     */
    private final boolean retainsScratch;

    private final String scratchDbName;

    private final String diffCommand;

    private final DiffFailurePolicy diffFailurePolicy;

    private final int diffParallelism;

    private final String dumpCommand;

    /**
     * Returns whether a password is configured.
     *
     * @return {@code true} when the password is neither {@code null} nor empty
     */
    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }
}
