/**
 * In-process domain event bus with middleware and a durable event log.
 *
 * @see autopilot.event.EventBus
 * @see autopilot.event.EventLogMiddleware
 */
package autopilot.event;
