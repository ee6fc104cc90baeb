/**
 * Units of work: one connection, one transaction, any number of repositories.
 */
package autopilot.tx;
