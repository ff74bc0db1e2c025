package io.github.yok.flexschemasync;

import io.github.yok.flexschemasync.config.CommandLineOptions;
import io.github.yok.flexschemasync.config.ConnectionConfig;
import io.github.yok.flexschemasync.config.PathsConfig;
import io.github.yok.flexschemasync.config.PullConfig;
import io.github.yok.flexschemasync.config.PushConfig;
import io.github.yok.flexschemasync.config.RunSettings;
import io.github.yok.flexschemasync.config.RunSettingsAssembler;
import io.github.yok.flexschemasync.config.SyncDirection;
import io.github.yok.flexschemasync.core.PullRunner;
import io.github.yok.flexschemasync.core.PushRunner;
import io.github.yok.flexschemasync.model.PushResult;
import io.github.yok.flexschemasync.util.ErrorHandler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code <livedbname>}: live database compared with the scratch database (positional)</li>
 * <li>{@code <direction>}: {@code push} applies the schema files to the live database,
 * {@code pull} regenerates the schema files from it (positional)</li>
 * <li>{@code --tab <dir>}: directory of {@code <tablename>.sql} files</li>
 * <li>{@code --host}, {@code --port}, {@code --user}, {@code --password}: MySQL server</li>
 * <li>{@code --retainsTmp <true|false>}: keep the scratch database after a push</li>
 * <li>{@code --pushScriptExportPath <file>}: where the push script is written</li>
 * <li>{@code --dryRunPush [true|false]}: write the push script without executing it</li>
 * </ul>
 *
 * <p>
 * Values not given on the command line come from {@code application.yml}. The process always ends
 * normally; the outcome is reported in the log.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see RunSettingsAssembler
 * @see PushRunner
 * @see PullRunner
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, PathsConfig.class, PushConfig.class,
        PullConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final RunSettingsAssembler settingsAssembler;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(maskPasswordArgument(args)));

        CommandLineOptions options = parseArguments(args);

        RunSettings settings;
        try {
            settings = settingsAssembler.assemble(options);
        } catch (IllegalArgumentException e) {
            ErrorHandler.errorAndExit(e.getMessage());
            return;
        }
        log.info("Using {}", settings);

        try {
            if (settings.getDirection() == SyncDirection.PUSH) {
                PushResult result = new PushRunner(settings).execute();
                log.info("Push completed with status {}", result.getStatus());
            } else {
                boolean pulled = new PullRunner(settings).execute();
                log.info("Pull completed (success={})", pulled);
            }
        } catch (Exception e) {
            log.error("Fatal error occurred (direction={}): {}", settings.getDirection(),
                    e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    /**
     * Parses the command line.
     *
     * @param args command-line arguments
     * @return parsed options; unknown options are logged and ignored
     */
    CommandLineOptions parseArguments(String... args) {
        CommandLineOptions options = new CommandLineOptions();
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--tab":
                    options.setTab(i + 1 < args.length ? args[++i] : null);
                    break;
                case "--host":
                    options.setHost(i + 1 < args.length ? args[++i] : null);
                    break;
                case "--port":
                    options.setPort(i + 1 < args.length ? args[++i] : null);
                    break;
                case "--user":
                    options.setUser(i + 1 < args.length ? args[++i] : null);
                    break;
                case "--password":
                    options.setPassword(i + 1 < args.length ? args[++i] : null);
                    break;
                case "--pushScriptExportPath":
                    options.setPushScriptExportPath(i + 1 < args.length ? args[++i] : null);
                    break;
                case "--retainsTmp":
                    if (isBooleanLiteral(args, i + 1)) {
                        options.setRetainsTmp(Boolean.parseBoolean(args[++i]));
                    } else {
                        options.setRetainsTmp(Boolean.TRUE);
                    }
                    break;
                case "--dryRunPush":
                    if (isBooleanLiteral(args, i + 1)) {
                        options.setDryRunPush(Boolean.parseBoolean(args[++i]));
                    } else {
                        options.setDryRunPush(Boolean.TRUE);
                    }
                    break;
                default:
                    if (args[i].startsWith("--")) {
                        log.warn("Unknown argument: {}", args[i]);
                    } else {
                        positional.add(args[i]);
                    }
            }
        }

        if (!positional.isEmpty()) {
            options.setLiveDbName(positional.get(0));
        }
        if (positional.size() > 1) {
            options.setDirection(positional.get(1));
        }
        if (positional.size() > 2) {
            log.warn("Ignoring extra arguments: {}", positional.subList(2, positional.size()));
        }
        return options;
    }

    private static boolean isBooleanLiteral(String[] args, int index) {
        return index < args.length
                && ("true".equalsIgnoreCase(args[index]) || "false".equalsIgnoreCase(args[index]));
    }

    private static String[] maskPasswordArgument(String[] args) {
        String[] masked = args.clone();
        for (int i = 0; i + 1 < masked.length; i++) {
            if ("--password".equals(masked[i])) {
                masked[i + 1] = "***";
            }
        }
        return masked;
    }
}
