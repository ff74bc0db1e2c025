/**
 * Immutable values passed between the push stages: schema files, reconciliation, script
 * fragments, and the results of loading and applying.
 */
package io.github.yok.flexschemasync.model;
