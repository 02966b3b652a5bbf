package io.statsbuffer;

import java.time.Duration;

/**
 * Per-metric-kind entry points for recording StatsD metrics.
 *
 * <p>All methods are safe to call concurrently from any number of threads. They do not
 * report transport failures; delivery happens later, in aggregated form.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (StatsdClient stats = StatsdBuffer.builder()
 *     .transport(transport)
 *     .flushInterval(Duration.ofSeconds(1))
 *     .build()) {
 *   stats.increment("requests", 1);
 *   stats.timing("request.latency", Duration.ofMillis(12));
 * }
 * }</pre>
 *
 * @see StatsdBuffer
 * @see NoopStatsdClient
 */
public interface StatsdClient extends AutoCloseable {

  /**
   * Adds {@code delta} to a counter. A zero delta is ignored.
   *
   * @param name  metric name
   * @param delta amount to add, may be negative
   */
  void increment(String name, long delta);

  /**
   * Subtracts {@code delta} from a counter. A zero delta is ignored.
   *
   * @param name  metric name
   * @param delta amount to subtract
   */
  void decrement(String name, long delta);

  /**
   * Records a duration sample.
   *
   * @param name     metric name
   * @param duration the measured duration, truncated to milliseconds
   */
  void timing(String name, Duration duration);

  /**
   * Records a duration sample given in milliseconds.
   *
   * @param name   metric name
   * @param millis the measured duration in milliseconds, must be &ge; 0
   */
  void timing(String name, long millis);

  /**
   * Sets a gauge. Zero is a meaningful reading and is always recorded.
   *
   * @param name  metric name
   * @param value the current reading
   */
  void gauge(String name, long value);

  /**
   * Adjusts a gauge relative to its current server-side value. A zero delta is ignored.
   *
   * @param name  metric name
   * @param delta signed adjustment
   */
  void gaugeDelta(String name, long delta);

  /**
   * Records an absolute value that the server must not average.
   *
   * @param name  metric name
   * @param value the value
   */
  void absolute(String name, long value);

  /**
   * Records the latest value of a continuously increasing total, e.g. reads since boot.
   *
   * @param name  metric name
   * @param value the running total
   */
  void total(String name, long value);

  /**
   * Delivers everything recorded so far and releases the underlying transport.
   */
  @Override
  void close();
}
