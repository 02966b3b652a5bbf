package io.statsbuffer.spi;

/**
 * Observability hook for exporting the buffer's own counters and gauges.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system. Methods are called from
 * submitting threads, the processing thread and flush threads, so implementations
 * must be thread-safe.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of events accepted into the submission queue.
   */
  void incrementEventsEnqueued();

  /**
   * Increments the count of accepted events that were dropped: either they conflicted
   * with a buffered event of another kind under the same key, or they were still queued
   * when the processing thread exited.
   */
  void incrementEventsRejected();

  /**
   * Increments the count of aggregated events the transport accepted.
   */
  void incrementSendSuccess();

  /**
   * Increments the count of aggregated events the transport failed to send.
   */
  void incrementSendFailure();

  /**
   * Records the number of messages waiting in the submission queue.
   *
   * @param depth current queue depth
   */
  void recordQueueDepth(int depth);

  /**
   * Records the number of distinct keys currently buffered.
   *
   * @param keys number of buffered keys
   */
  void recordBufferedKeys(int keys);

  /**
   * Records how long a flush took, from taking the map to the last send completing.
   *
   * @param durationMs flush time in milliseconds (always non-negative)
   */
  default void recordFlushDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEventsEnqueued() {
    }

    @Override
    public void incrementEventsRejected() {
    }

    @Override
    public void incrementSendSuccess() {
    }

    @Override
    public void incrementSendFailure() {
    }

    @Override
    public void recordQueueDepth(int depth) {
    }

    @Override
    public void recordBufferedKeys(int keys) {
    }
  }
}
