/**
 * External MySQL command-line tools the workflows delegate to.
 *
 * <p>
 * {@code mysqldiff} computes the per-table ALTER statements of a push and {@code mysqldump}
 * regenerates the schema files on pull. Both are started through
 * {@link io.github.yok.flexschemasync.tool.CommandRunner} so they can be replaced in tests.
 * </p>
 */
package io.github.yok.flexschemasync.tool;
