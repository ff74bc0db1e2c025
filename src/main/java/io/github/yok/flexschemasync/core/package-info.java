/**
 * Push and pull workflows.
 *
 * <p>
 * {@link io.github.yok.flexschemasync.core.PushRunner} sequences the push stages: live schema
 * inspection, scratch database loading, reconciliation, script assembly and application.
 * {@link io.github.yok.flexschemasync.core.PullRunner} regenerates the schema files.
 * </p>
 *
 * <p>
 * {@link io.github.yok.flexschemasync.core.SchemaReconciler} is the only stage without I/O.
 * </p>
 */
package io.github.yok.flexschemasync.core;
