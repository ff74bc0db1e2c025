/**
 * Small helpers shared by the push and pull workflows: fatal-error reporting, credential masking
 * for logs, and clean-up of dump-tool artifacts in schema files.
 */
package io.github.yok.flexschemasync.util;
