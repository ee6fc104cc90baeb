/**
 * Autonomous content scheduler with a quality-gated, batched persistence pipeline.
 *
 * <p>{@link autopilot.Autopilot} wires every component from a connection factory, the
 * store implementations and a {@link autopilot.spi.GenerationClient}.
 *
 * @see autopilot.Autopilot
 * @see autopilot.scheduler.AutonomousScheduler
 */
package autopilot;
