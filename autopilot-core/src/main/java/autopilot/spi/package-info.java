/**
 * Service provider interfaces for pluggable components.
 *
 * <p>Store interfaces operate on caller-supplied JDBC connections; the caller owns the
 * transaction. The {@code autopilot-jdbc} module implements every store.
 * {@link autopilot.spi.GenerationClient} and {@link autopilot.spi.ResourceHealthProbe}
 * are supplied by the hosting application.
 */
package autopilot.spi;
