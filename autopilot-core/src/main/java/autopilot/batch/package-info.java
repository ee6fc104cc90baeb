/**
 * Buffered, chunked, transactional entity writes.
 *
 * <p>{@link autopilot.batch.BatchWriteCoordinator} flushes on size, on a timer or on
 * demand. Each chunk commits or rolls back as a whole; items of a rolled-back chunk are
 * requeued ahead of newer ones until their retries run out.
 *
 * @see autopilot.batch.BatchWriteCoordinator
 * @see autopilot.batch.EventFactory
 */
package autopilot.batch;
