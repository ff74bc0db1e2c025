package io.github.yok.flexschemasync.core;

import io.github.yok.flexschemasync.db.SqlExecutor;
import io.github.yok.flexschemasync.model.ApplyResult;
import io.github.yok.flexschemasync.model.PushScript;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.sql.Connection;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Writes the push script to its export path and, unless dry run, executes it on the live
 * database as one multi-statement batch.
 *
 * <p>
 * The file is written first and independently of the execution, so it is available for
 * inspection or manual replay whatever happens next. Neither a write failure nor an execution
 * failure is thrown; both are logged and reflected in the {@link ApplyResult}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PushScriptApplier {

    private final Path exportPath;
    private final boolean dryRun;

    /**
     * Creates an applier.
     *
     * @param exportPath file the script is written to (overwritten if present)
     * @param dryRun skip execution when {@code true}
     */
    public PushScriptApplier(Path exportPath, boolean dryRun) {
        this.exportPath = exportPath;
        this.dryRun = dryRun;
    }

    /**
     * Exports and executes the script.
     *
     * @param live connection to the live database
     * @param script script to apply
     * @return export location and execution outcome
     */
    public ApplyResult apply(Connection live, PushScript script) {
        String text = script.getText();
        log.info("The final pushScript is\n{}", text);

        Path exported = export(text);

        if (dryRun) {
            log.info("Dry run: push script not executed.");
            return new ApplyResult(exported, false, null);
        }
        if (script.isBlank()) {
            log.info("Push script has no statement; live database already matches.");
            return new ApplyResult(exported, false, null);
        }

        try {
            SqlExecutor.executeAll(live, text);
            log.info("Push script executed on the live database.");
            return new ApplyResult(exported, true, null);
        } catch (SQLException e) {
            log.error("Push script execution failed; exported script: {}", exported, e);
            return new ApplyResult(exported, true,
                    StringUtils.defaultString(e.getMessage(), e.getClass().getSimpleName()));
        }
    }

    /**
     * Writes the script to the export path.
     *
     * @param text script text
     * @return the export path, or {@code null} if writing failed
     */
    Path export(String text) {
        try {
            Path parent = exportPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(exportPath, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            log.info("Push script exported to {}", exportPath);
            return exportPath;
        } catch (IOException e) {
            log.error("Failed to export push script to {}", exportPath, e);
            return null;
        }
    }
}
