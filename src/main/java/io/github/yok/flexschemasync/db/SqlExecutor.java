package io.github.yok.flexschemasync.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.Generated;

/**
 * Executes SQL text that may hold several statements.
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqlExecutor {

    @Generated
    private SqlExecutor() {}

    /**
     * Executes the text as one batch and walks every result it produces.
     *
     * <p>
     * With {@code allowMultiQueries} the driver reports an error of a later statement only when
     * its result is reached, so all results are consumed here.
     * </p>
     *
     * @param conn connection
     * @param sql one or more statements
     * @throws SQLException if any statement fails
     */
    public static void executeAll(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            boolean hasResultSet = st.execute(sql);
            while (hasResultSet || st.getUpdateCount() != -1) {
                hasResultSet = st.getMoreResults();
            }
        }
    }
}
