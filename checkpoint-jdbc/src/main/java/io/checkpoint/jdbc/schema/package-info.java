/**
 * Idempotent schema provisioning: declare a {@link io.checkpoint.jdbc.schema.TableDefinition},
 * let {@link io.checkpoint.jdbc.schema.SchemaSynchronizer} diff it against the database
 * metadata and apply what is missing.
 */
package io.checkpoint.jdbc.schema;
