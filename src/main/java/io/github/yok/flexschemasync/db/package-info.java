/**
 * JDBC access to the MySQL server holding the live and the scratch database.
 */
package io.github.yok.flexschemasync.db;
