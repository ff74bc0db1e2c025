package io.github.yok.flexschemasync.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.flexschemasync.db.SqlExecutor;
import io.github.yok.flexschemasync.model.LoadReport;
import io.github.yok.flexschemasync.model.SchemaFile;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Builds the scratch database: a structural mirror of the schema files that the diff tool can
 * compare table by table with the live database.
 *
 * <p>
 * Recreating the database is all-or-nothing. Loading is per file: a file that fails is logged as
 * "Not sourced" and the remaining files are still loaded.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ScratchDatabaseLoader {

    private final String scratchDbName;
    private final FileSchemaReader fileSchemaReader;

    /**
     * Creates a loader.
     *
     * @param scratchDbName name of the scratch database
     * @param fileSchemaReader reader used to obtain the sanitized file contents
     */
    public ScratchDatabaseLoader(String scratchDbName, FileSchemaReader fileSchemaReader) {
        this.scratchDbName = scratchDbName;
        this.fileSchemaReader = fileSchemaReader;
    }

    /**
     * Drops and creates the scratch database and makes it the connection's default database.
     *
     * @param server connection without a default database
     * @throws SQLException if any of the statements fails
     */
    public void recreate(Connection server) throws SQLException {
        String drop = dropStatement();
        String create = "CREATE DATABASE " + scratchDbName;
        log.info("About to execute\n\t{}\n\t{}", drop, create);
        execute(server, drop);
        execute(server, create);
        log.info("About to use database {}.", scratchDbName);
        execute(server, "USE " + scratchDbName);
    }

    /**
     * Executes every schema file against the scratch database, one at a time and in order.
     *
     * @param scratch connection whose default database is the scratch database
     * @param files schema files
     * @return tables sourced and tables not sourced
     */
    public LoadReport load(Connection scratch, List<SchemaFile> files) {
        ImmutableList.Builder<String> sourced = ImmutableList.builder();
        Map<String, String> notSourced = new LinkedHashMap<>();

        for (SchemaFile file : files) {
            log.info("About to source {} with database {}.", file.getPath().getFileName(),
                    scratchDbName);
            try {
                String sql = fileSchemaReader.readSanitized(file);
                if (StringUtils.isBlank(sql)) {
                    log.warn("Not sourced: {} is empty after stripping directives.",
                            file.getPath().getFileName());
                    notSourced.put(file.getTableName(), "empty schema file");
                    continue;
                }
                execute(scratch, sql);
                sourced.add(file.getTableName());
                log.info("Sourced.");
            } catch (IOException | SQLException e) {
                log.error("Failed to source {}", file.getPath(), e);
                log.warn("Not sourced.");
                notSourced.put(file.getTableName(),
                        StringUtils.defaultString(e.getMessage(), e.getClass().getSimpleName()));
            }
        }

        LoadReport report = new LoadReport(sourced.build(), ImmutableMap.copyOf(notSourced));
        log.info("Scratch database {} loaded: sourced={}, not sourced={}", scratchDbName,
                report.getSourced().size(), report.getNotSourced().keySet());
        return report;
    }

    /**
     * Drops the scratch database. A failure is logged and reported, never thrown.
     *
     * @param server connection to the server
     * @return {@code true} if the database was dropped
     */
    public boolean drop(Connection server) {
        String drop = dropStatement();
        log.info("About to execute\n\t{}", drop);
        try {
            execute(server, drop);
            return true;
        } catch (SQLException e) {
            log.error("Failed to drop scratch database {}", scratchDbName, e);
            return false;
        }
    }

    private String dropStatement() {
        return "DROP DATABASE IF EXISTS " + scratchDbName;
    }

    private static void execute(Connection conn, String sql) throws SQLException {
        SqlExecutor.executeAll(conn, sql);
    }
}
