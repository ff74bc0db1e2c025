package io.github.yok.flexschemasync.core;

import io.github.yok.flexschemasync.config.RunSettings;
import io.github.yok.flexschemasync.db.DbConnectionProvider;
import io.github.yok.flexschemasync.db.MySqlConnectionProvider;
import io.github.yok.flexschemasync.model.ApplyResult;
import io.github.yok.flexschemasync.model.LoadReport;
import io.github.yok.flexschemasync.model.PushResult;
import io.github.yok.flexschemasync.model.PushScript;
import io.github.yok.flexschemasync.model.PushStatus;
import io.github.yok.flexschemasync.model.ReconciliationResult;
import io.github.yok.flexschemasync.model.SchemaFile;
import io.github.yok.flexschemasync.tool.MysqlDiffInvoker;
import io.github.yok.flexschemasync.tool.StructuralDiffer;
import io.github.yok.flexschemasync.util.ErrorHandler;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a push: applies the schema files to the live database.
 *
 * <p>
 * <strong>Stages</strong> (each waits for the previous one):
 * </p>
 * <ol>
 * <li>list the live tables</li>
 * <li>recreate the scratch database</li>
 * <li>list the schema files</li>
 * <li>load every file into the scratch database (per-file failures are tolerated)</li>
 * <li>reconcile file-defined and live table names</li>
 * <li>assemble the push script</li>
 * <li>export and, unless dry run, execute the script</li>
 * </ol>
 *
 * <p>
 * A failure in stages 1–3 or 6 aborts the push through {@link ErrorHandler}. Whatever the
 * outcome, the scratch database is dropped afterwards unless it is to be retained.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PushRunner {

    private final RunSettings settings;
    private final DbConnectionProvider connectionProvider;
    private final FileSchemaReader fileSchemaReader;
    private final LiveSchemaInspector liveSchemaInspector;
    private final ScratchDatabaseLoader scratchLoader;
    private final PushScriptAssembler assembler;
    private final PushScriptApplier applier;

    /**
     * Creates a runner against MySQL using {@code mysqldiff}.
     *
     * @param settings run settings
     */
    public PushRunner(RunSettings settings) {
        this(settings, new MySqlConnectionProvider(settings), new MysqlDiffInvoker(settings));
    }

    /**
     * Creates a runner with custom connection and diff collaborators.
     *
     * @param settings run settings
     * @param connectionProvider opens the live and server connections
     * @param differ structural diff collaborator
     */
    public PushRunner(RunSettings settings, DbConnectionProvider connectionProvider,
            StructuralDiffer differ) {
        this.settings = settings;
        this.connectionProvider = connectionProvider;
        this.fileSchemaReader = new FileSchemaReader(settings.getSchemaFileSuffix());
        this.liveSchemaInspector = new LiveSchemaInspector();
        this.scratchLoader =
                new ScratchDatabaseLoader(settings.getScratchDbName(), fileSchemaReader);
        this.assembler = new PushScriptAssembler(fileSchemaReader, differ,
                settings.getDiffFailurePolicy(), settings.getDiffParallelism());
        this.applier =
                new PushScriptApplier(settings.getPushScriptExportPath(), settings.isDryRunPush());
    }

    /**
     * Runs the push.
     *
     * @return outcome of the run; {@link PushStatus#ABORTED} after a fatal error
     */
    public PushResult execute() {
        log.info("=== Push started (live={}, tab={}, dryRun={}) ===", settings.getLiveDbName(),
                settings.getSchemaDir(), settings.isDryRunPush());

        PushResult result;
        try (Connection live = connectionProvider.openLive();
                Connection server = connectionProvider.openServer()) {
            result = pushWithCleanup(live, server);
        } catch (SQLException e) {
            ErrorHandler.errorAndExit("Cannot connect to MySQL server " + settings.getHost() + ":"
                    + settings.getPort(), e);
            result = PushResult.aborted();
        }

        log.info("=== Push finished (status={}) ===", result.getStatus());
        return result;
    }

    private PushResult pushWithCleanup(Connection live, Connection server) {
        try {
            return push(live, server);
        } catch (SQLException | IOException | IllegalStateException e) {
            ErrorHandler.errorAndExit("Push aborted: " + e.getMessage(), e);
            return PushResult.aborted();
        } finally {
            cleanupScratch(server);
        }
    }

    private PushResult push(Connection live, Connection server) throws SQLException, IOException {
        List<String> liveTables = liveSchemaInspector.listTables(live);

        scratchLoader.recreate(server);

        List<SchemaFile> files = fileSchemaReader.listSchemaFiles(settings.getSchemaDir());
        LoadReport loadReport = scratchLoader.load(server, files);

        List<String> fileTables =
                files.stream().map(SchemaFile::getTableName).collect(Collectors.toList());
        ReconciliationResult reconciliation = SchemaReconciler.reconcile(fileTables, liveTables);
        log.info(
                "versionControlledTables: {}\nliveTables: {}\nmergedTables: {}\n"
                        + "exclusiveVersionControlledTables: {}\nexclusiveLiveTables: {}",
                fileTables, liveTables, reconciliation.getMerged(),
                reconciliation.getOnlyInFiles(), reconciliation.getOnlyLive());

        Map<String, SchemaFile> filesByTable = files.stream().collect(Collectors.toMap(
                SchemaFile::getTableName, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        PushScript script = assembler.assemble(reconciliation, filesByTable);

        ApplyResult applyResult = applier.apply(live, script);

        return PushResult.builder().status(statusOf(applyResult)).reconciliation(reconciliation)
                .loadReport(loadReport).script(script).applyResult(applyResult).build();
    }

    private PushStatus statusOf(ApplyResult applyResult) {
        if (settings.isDryRunPush()) {
            return PushStatus.DRY_RUN;
        }
        return applyResult.isSucceeded() ? PushStatus.APPLIED : PushStatus.EXECUTION_FAILED;
    }

    private void cleanupScratch(Connection server) {
        if (settings.isRetainsScratch()) {
            log.info("Scratch database {} retained.", settings.getScratchDbName());
            return;
        }
        scratchLoader.drop(server);
    }
}
