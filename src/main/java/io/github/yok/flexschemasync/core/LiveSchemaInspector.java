package io.github.yok.flexschemasync.core;

import com.google.common.collect.ImmutableList;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the table names of the live database.
 *
 * <p>
 * Views are listed too. A pull writes one file per table and per view, so a view present on both
 * sides goes to the structural diff instead of being created again.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LiveSchemaInspector {

    static final String SHOW_TABLES_SQL = "SHOW TABLES";

    /**
     * Lists the tables and views of the connection's default database in the order the server
     * reports them.
     *
     * @param live connection whose default database is the live database
     * @return table names
     * @throws SQLException if the query fails
     */
    public ImmutableList<String> listTables(Connection live) throws SQLException {
        ImmutableList.Builder<String> tables = ImmutableList.builder();
        try (Statement st = live.createStatement(); ResultSet rs = st.executeQuery(SHOW_TABLES_SQL)) {
            while (rs.next()) {
                tables.add(rs.getString(1));
            }
        }
        ImmutableList<String> result = tables.build();
        log.info("Live database has {} table(s): {}", result.size(), result);
        return result;
    }
}
