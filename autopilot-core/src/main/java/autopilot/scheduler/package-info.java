/**
 * The autonomous tick: gating, operation selection, generation, assessment and
 * persistence.
 *
 * @see autopilot.scheduler.AutonomousScheduler
 */
package autopilot.scheduler;
