/**
 * Database dialects: DDL type mapping, the lock-without-waiting clause and
 * classification of lock and constraint errors for H2, MySQL/TiDB and PostgreSQL.
 *
 * @see io.checkpoint.jdbc.dialect.Dialect
 * @see io.checkpoint.jdbc.dialect.Dialects
 */
package io.checkpoint.jdbc.dialect;
