/**
 * Micrometer bridge for exporting scheduler and persistence metrics to Prometheus,
 * Grafana, and other backends.
 *
 * <p>{@link autopilot.micrometer.MicrometerMetricsExporter} implements the
 * {@link autopilot.spi.MetricsExporter} SPI using Micrometer counters, gauges and
 * distribution summaries.
 */
package autopilot.micrometer;
