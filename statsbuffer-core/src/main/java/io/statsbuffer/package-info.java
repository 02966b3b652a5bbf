/**
 * Core API for aggregating StatsD metrics in memory before sending them.
 *
 * <p>Start with {@link io.statsbuffer.StatsdBuffer#builder()} to create a
 * {@link io.statsbuffer.StatsdClient} that merges events per metric name and
 * flushes them to a {@link io.statsbuffer.spi.Transport} on a fixed interval.
 *
 * @see io.statsbuffer.StatsdBuffer
 * @see io.statsbuffer.StatsdClient
 */
package io.statsbuffer;
