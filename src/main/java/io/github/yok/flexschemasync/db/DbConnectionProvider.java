package io.github.yok.flexschemasync.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens the two connections a push holds: one bound to the live database and one bound to the
 * server only, used to build the scratch database.
 */
public interface DbConnectionProvider {

    /**
     * Opens a connection whose default database is the live database.
     *
     * @return new connection owned by the caller
     * @throws SQLException if the connection cannot be established
     */
    Connection openLive() throws SQLException;

    /**
     * Opens a connection without a default database.
     *
     * @return new connection owned by the caller
     * @throws SQLException if the connection cannot be established
     */
    Connection openServer() throws SQLException;
}
