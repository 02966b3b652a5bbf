package io.statsbuffer.event;

import java.util.List;

/**
 * A metric datapoint that can absorb later datapoints with the same identity.
 *
 * <p>The set of event kinds is closed. Each kind defines its own merge rule:
 * <ul>
 *   <li>{@link Increment} and {@link GaugeDelta} sum their deltas</li>
 *   <li>{@link Gauge}, {@link Absolute} and {@link Total} keep the latest value</li>
 *   <li>{@link Timing} accumulates samples into a distribution</li>
 * </ul>
 *
 * <p>Events are mutable and not thread-safe. Once submitted to a
 * {@link io.statsbuffer.StatsdBuffer} they are owned by its processing thread.
 */
public sealed interface Event permits Increment, Gauge, GaugeDelta, Absolute, Total, Timing {

  /**
   * Returns the metric name.
   *
   * @return the metric name, never empty
   */
  String name();

  /**
   * Returns the identity key. Events merge only when their keys are equal.
   *
   * @return the identity key
   */
  default String key() {
    return name();
  }

  /**
   * Returns the StatsD type suffix, e.g. {@code c} for counters or {@code ms} for timings.
   *
   * @return the type suffix
   */
  String typeName();

  /**
   * Merges {@code other} into this event in place.
   *
   * @param other a later event with the same key and kind
   * @throws IncompatibleEventException if {@code other} has a different key or kind
   */
  void merge(Event other);

  /**
   * Renders the current aggregate as StatsD protocol lines.
   *
   * @return one or more lines, without trailing newlines
   */
  List<String> stats();
}
