/**
 * Manual JDBC transaction management.
 *
 * @see io.checkpoint.jdbc.tx.JdbcTransactionManager
 */
package io.checkpoint.jdbc.tx;
