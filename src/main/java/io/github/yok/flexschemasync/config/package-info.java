/**
 * Configuration models.
 *
 * <p>
 * The {@code *Config} classes are bound from {@code application.yml} by Spring Boot.
 * {@link io.github.yok.flexschemasync.config.RunSettingsAssembler} folds them together with the
 * command-line overrides into one immutable
 * {@link io.github.yok.flexschemasync.config.RunSettings} per run.
 * </p>
 */
package io.github.yok.flexschemasync.config;
