/**
 * Micrometer bridge for exporting the buffer's own metrics.
 *
 * <p>{@link io.statsbuffer.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.statsbuffer.spi.MetricsExporter} SPI using Micrometer counters, gauges and a timer.
 *
 * @see io.statsbuffer.micrometer.MicrometerMetricsExporter
 */
package io.statsbuffer.micrometer;
