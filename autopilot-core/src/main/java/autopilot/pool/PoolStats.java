package autopilot.pool;

/**
 * Point-in-time view of a {@link ConnectionPool}.
 *
 * @param total   open physical connections, leased or idle
 * @param active  connections currently leased
 * @param idle    connections available for reuse
 * @param waiting callers blocked in {@code acquire}
 */
public record PoolStats(int total, int active, int idle, int waiting) {
}
