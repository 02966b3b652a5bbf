package io.statsbuffer.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.statsbuffer.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and a timer with a {@link MeterRegistry} so the buffer's
 * own health shows up next to the application's other meters.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code statsd.buffer.events.enqueued}: events accepted into the queue</li>
 *   <li>{@code statsd.buffer.events.rejected}: events dropped on a kind conflict or at shutdown</li>
 *   <li>{@code statsd.buffer.send.success}: aggregates the transport accepted</li>
 *   <li>{@code statsd.buffer.send.failure}: aggregates the transport failed to send</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code statsd.buffer.queue.depth}: messages waiting in the submission queue</li>
 *   <li>{@code statsd.buffer.buffered.keys}: distinct keys awaiting the next flush</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code statsd.buffer.flush.duration}: time taken by each non-empty flush</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter eventsEnqueued;
  private final Counter eventsRejected;
  private final Counter sendSuccess;
  private final Counter sendFailure;
  private final Gauge queueDepthGauge;
  private final Gauge bufferedKeysGauge;
  private final Timer flushDuration;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicInteger bufferedKeys = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "statsd.buffer"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "statsd.buffer");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "checkout.statsd"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.eventsEnqueued = Counter.builder(namePrefix + ".events.enqueued")
        .description("Events accepted into the submission queue")
        .register(registry);
    this.eventsRejected = Counter.builder(namePrefix + ".events.rejected")
        .description("Accepted events dropped on a kind conflict or at shutdown")
        .register(registry);
    this.sendSuccess = Counter.builder(namePrefix + ".send.success")
        .description("Aggregated events accepted by the transport")
        .register(registry);
    this.sendFailure = Counter.builder(namePrefix + ".send.failure")
        .description("Aggregated events the transport failed to send")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.bufferedKeysGauge = Gauge.builder(namePrefix + ".buffered.keys", bufferedKeys, AtomicInteger::get)
        .register(registry);
    this.flushDuration = Timer.builder(namePrefix + ".flush.duration")
        .description("Time to send every buffered aggregate")
        .register(registry);
  }

  @Override
  public void incrementEventsEnqueued() {
    if (closed) return;
    eventsEnqueued.increment();
  }

  @Override
  public void incrementEventsRejected() {
    if (closed) return;
    eventsRejected.increment();
  }

  @Override
  public void incrementSendSuccess() {
    if (closed) return;
    sendSuccess.increment();
  }

  @Override
  public void incrementSendFailure() {
    if (closed) return;
    sendFailure.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordBufferedKeys(int keys) {
    if (closed) return;
    bufferedKeys.set(keys);
  }

  @Override
  public void recordFlushDurationMs(long durationMs) {
    if (closed) return;
    flushDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>The buffer does not close its exporter. Call this after closing the buffer, or let
   * the container that created the exporter do it, so no stale gauges are left behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(eventsEnqueued, eventsRejected, sendSuccess, sendFailure,
        queueDepthGauge, bufferedKeysGauge, flushDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
