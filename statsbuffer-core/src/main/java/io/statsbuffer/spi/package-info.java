/**
 * Service Provider Interfaces (SPI) for plugging the buffer into its surroundings.
 *
 * <p>{@link io.statsbuffer.spi.Transport} receives the aggregated events and
 * {@link io.statsbuffer.spi.MetricsExporter} observes the buffer itself.
 *
 * @see io.statsbuffer.spi.Transport
 * @see io.statsbuffer.spi.MetricsExporter
 */
package io.statsbuffer.spi;
