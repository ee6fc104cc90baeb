/**
 * JDBC support: template, table names, schema DDL and a
 * {@link autopilot.pool.ConnectionFactory} over a {@link javax.sql.DataSource}.
 */
package autopilot.jdbc;
