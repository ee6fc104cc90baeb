/**
 * Bounded JDBC connection pool.
 */
package autopilot.pool;
