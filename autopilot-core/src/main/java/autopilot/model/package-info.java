/**
 * Immutable domain records and their enums.
 */
package autopilot.model;
