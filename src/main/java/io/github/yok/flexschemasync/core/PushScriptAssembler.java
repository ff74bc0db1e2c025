package io.github.yok.flexschemasync.core;

import com.google.common.base.Preconditions;
import io.github.yok.flexschemasync.config.DiffFailurePolicy;
import io.github.yok.flexschemasync.model.FragmentKind;
import io.github.yok.flexschemasync.model.PushScript;
import io.github.yok.flexschemasync.model.ReconciliationResult;
import io.github.yok.flexschemasync.model.SchemaFile;
import io.github.yok.flexschemasync.model.ScriptFragment;
import io.github.yok.flexschemasync.tool.DiffResult;
import io.github.yok.flexschemasync.tool.StructuralDiffer;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a {@link ReconciliationResult} into the push script.
 *
 * <p>
 * One fragment per table, in {@code merged} order:
 * </p>
 * <ul>
 * <li>only in files: the sanitized CREATE statement of its schema file</li>
 * <li>only live: {@code DROP TABLE IF EXISTS <table>;}</li>
 * <li>in both: the output of the {@link StructuralDiffer}, possibly empty</li>
 * </ul>
 *
 * <p>
 * Diffs are queued in {@code merged} order. With a parallelism above one they run on a bounded
 * pool, but the script is still assembled in {@code merged} order. A failed diff is handled
 * according to the {@link DiffFailurePolicy}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PushScriptAssembler {

    private final FileSchemaReader fileSchemaReader;
    private final StructuralDiffer differ;
    private final DiffFailurePolicy failurePolicy;
    private final int parallelism;

    /**
     * Creates an assembler.
     *
     * @param fileSchemaReader reader for the CREATE statements of new tables
     * @param differ structural diff collaborator
     * @param failurePolicy what to do with a failed diff
     * @param parallelism maximum number of diffs running at the same time, at least 1
     */
    public PushScriptAssembler(FileSchemaReader fileSchemaReader, StructuralDiffer differ,
            DiffFailurePolicy failurePolicy, int parallelism) {
        Preconditions.checkArgument(parallelism >= 1, "parallelism must be >= 1: %s",
                parallelism);
        this.fileSchemaReader = fileSchemaReader;
        this.differ = differ;
        this.failurePolicy = failurePolicy;
        this.parallelism = parallelism;
    }

    /**
     * Assembles the push script.
     *
     * @param reconciliation reconciled table names
     * @param filesByTable schema files keyed by table name
     * @return script with one fragment per merged table
     * @throws IOException if a schema file of a new table cannot be read
     * @throws IllegalStateException if a diff fails under {@link DiffFailurePolicy#ABORT}, or a
     *         new table has no schema file
     */
    public PushScript assemble(ReconciliationResult reconciliation,
            Map<String, SchemaFile> filesByTable) throws IOException {
        Map<String, DiffResult> diffs = runDiffs(reconciliation.getInBoth());

        PushScript script = PushScript.empty();
        for (String table : reconciliation.getMerged()) {
            script = script.append(fragmentFor(table, reconciliation.classify(table),
                    filesByTable, diffs));
        }
        log.info("Push script assembled: create={}, drop={}, alter={}",
                script.count(FragmentKind.CREATE), script.count(FragmentKind.DROP),
                script.count(FragmentKind.ALTER));
        return script;
    }

    private ScriptFragment fragmentFor(String table, FragmentKind kind,
            Map<String, SchemaFile> filesByTable, Map<String, DiffResult> diffs)
            throws IOException {
        switch (kind) {
            case CREATE:
                log.info("[{}] This is a new table to be created in the livedb.", table);
                SchemaFile file = filesByTable.get(table);
                if (file == null) {
                    throw new IllegalStateException("No schema file for new table: " + table);
                }
                return new ScriptFragment(table, kind, fileSchemaReader.readSanitized(file));
            case DROP:
                log.info("[{}] This is a table to be dropped from the livedb.", table);
                return new ScriptFragment(table, kind, "DROP TABLE IF EXISTS " + table + ";");
            default:
                return new ScriptFragment(table, kind, diffs.get(table).getOutput());
        }
    }

    /**
     * Runs the structural diffs of the given tables.
     *
     * @param tables tables present on both sides, in merged order
     * @return usable diff per table, in the same order
     */
    Map<String, DiffResult> runDiffs(List<String> tables) {
        Map<String, DiffResult> results = new LinkedHashMap<>();
        if (tables.isEmpty()) {
            return results;
        }
        if (parallelism == 1) {
            for (String table : tables) {
                results.put(table, accept(diffSafely(table)));
            }
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tables.size()));
        try {
            Map<String, Future<DiffResult>> pending = new LinkedHashMap<>();
            for (String table : tables) {
                pending.put(table, executor.submit(() -> diffSafely(table)));
            }
            for (Map.Entry<String, Future<DiffResult>> entry : pending.entrySet()) {
                results.put(entry.getKey(), accept(await(entry.getKey(), entry.getValue())));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private DiffResult diffSafely(String table) {
        try {
            return differ.diff(table);
        } catch (RuntimeException e) {
            log.error("[{}] Structural diff threw an exception", table, e);
            return DiffResult.failure(table, e.toString());
        }
    }

    private DiffResult await(String table, Future<DiffResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            return DiffResult.failure(table, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while diffing table " + table, e);
        }
    }

    private DiffResult accept(DiffResult result) {
        if (result.isSuccess()) {
            return result;
        }
        if (failurePolicy == DiffFailurePolicy.ABORT) {
            throw new IllegalStateException("Structural diff failed for table "
                    + result.getTableName() + ": " + result.getFailureReason());
        }
        log.warn("[{}] Structural diff failed, no ALTER emitted: {}", result.getTableName(),
                result.getFailureReason());
        return DiffResult.success(result.getTableName(), "");
    }
}
