/**
 * JDBC implementations of the store SPIs. Each store takes an optional table name and
 * {@link autopilot.util.JsonCodec}; the defaults match {@link autopilot.jdbc.AutopilotSchema}.
 */
package autopilot.jdbc.store;
