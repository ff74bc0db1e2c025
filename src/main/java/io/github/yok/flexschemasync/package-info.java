/**
 * Root package of FlexSchemaSync.
 *
 * <p>
 * Provides a CLI that reconciles a directory of per-table {@code .sql} schema files with a live
 * MySQL database, in both directions.
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.flexschemasync.config}: configuration models</li>
 * <li>{@code io.github.yok.flexschemasync.core}: push and pull workflows</li>
 * <li>{@code io.github.yok.flexschemasync.model}: values passed between push stages</li>
 * <li>{@code io.github.yok.flexschemasync.db}: JDBC connections and batch execution</li>
 * <li>{@code io.github.yok.flexschemasync.tool}: external {@code mysqldiff}/{@code mysqldump}</li>
 * </ul>
 */
package io.github.yok.flexschemasync;
