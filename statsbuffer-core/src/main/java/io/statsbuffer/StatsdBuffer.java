package io.statsbuffer;

import io.statsbuffer.event.Absolute;
import io.statsbuffer.event.Event;
import io.statsbuffer.event.Gauge;
import io.statsbuffer.event.GaugeDelta;
import io.statsbuffer.event.IncompatibleEventException;
import io.statsbuffer.event.Increment;
import io.statsbuffer.event.Timing;
import io.statsbuffer.event.Total;
import io.statsbuffer.spi.MetricsExporter;
import io.statsbuffer.spi.Transport;
import io.statsbuffer.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link StatsdClient} that merges events in memory and flushes one aggregate per
 * metric name to a {@link Transport} on a fixed interval.
 *
 * <p>A single processing thread owns the aggregation map. Callers never touch it: each
 * facade call builds an {@link Event} and places it on a bounded FIFO queue. The
 * processing thread takes messages off that queue, merges events by
 * {@linkplain Event#key() key}, and flushes the whole map whenever the flush interval
 * elapses. Because every mutation happens on that thread, the map needs no lock.
 *
 * <p>A flush sends every buffered event concurrently and waits for all sends. A failed
 * send is logged and counted but neither retried nor allowed to stop the other sends.
 *
 * <p>{@link #close()} travels through the same queue as the events, so the final flush
 * includes everything the closing thread submitted before calling it. If the processing
 * thread fails unexpectedly it flushes what it holds before the failure propagates.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see StatsdBuffer.Builder
 * @see Transport
 */
public final class StatsdBuffer implements StatsdClient {
  private static final Logger logger = Logger.getLogger(StatsdBuffer.class.getName());

  private static final long QUEUE_OFFER_TIMEOUT_MS = 50;

  /** Lifecycle of the processing thread. */
  public enum State {
    /** Accepting and merging events. */
    RUNNING,
    /** Close requested; events already queued are still being merged. */
    DRAINING,
    /** Processing thread has exited. */
    STOPPED
  }

  private sealed interface Message permits Submit, CloseRequest {}

  private record Submit(Event event) implements Message {}

  private record CloseRequest(CompletableFuture<Void> reply) implements Message {}

  private final Transport transport;
  private final boolean closeTransport;
  private final long flushIntervalNanos;
  private final Duration closeTimeout;
  private final MetricsExporter metrics;
  private final BlockingQueue<Message> queue;
  private final ExecutorService flushExecutor;
  private final Thread processor;
  private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
  private final AtomicBoolean closeCalled = new AtomicBoolean(false);
  private final CompletableFuture<Void> terminated = new CompletableFuture<>();

  // Owned by the processing thread.
  private final Map<String, Event> events = new HashMap<>();

  private StatsdBuffer(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    Duration flushInterval = Objects.requireNonNull(builder.flushInterval, "flushInterval");
    if (flushInterval.isZero() || flushInterval.isNegative()) {
      throw new IllegalArgumentException("flushInterval must be > 0");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.closeTimeout != null
        && (builder.closeTimeout.isZero() || builder.closeTimeout.isNegative())) {
      throw new IllegalArgumentException("closeTimeout must be > 0");
    }
    this.flushIntervalNanos = flushInterval.toNanos();
    this.closeTimeout = builder.closeTimeout;
    this.closeTransport = builder.closeTransport;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.queue = new ArrayBlockingQueue<>(builder.queueCapacity);
    this.flushExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("statsd-buffer-flush-"));
    this.processor = new DaemonThreadFactory("statsd-buffer-").newThread(this::processLoop);
    this.processor.start();
  }

  public static Builder builder() {
    return new Builder();
  }

  public State state() {
    return state.get();
  }

  @Override
  public void increment(String name, long delta) {
    if (delta != 0) {
      submit(new Increment(name, delta));
    }
  }

  @Override
  public void decrement(String name, long delta) {
    if (delta != 0) {
      submit(new Increment(name, -delta));
    }
  }

  @Override
  public void timing(String name, Duration duration) {
    submit(new Timing(name, duration));
  }

  @Override
  public void timing(String name, long millis) {
    submit(new Timing(name, millis));
  }

  @Override
  public void gauge(String name, long value) {
    submit(new Gauge(name, value));
  }

  @Override
  public void gaugeDelta(String name, long delta) {
    if (delta != 0) {
      submit(new GaugeDelta(name, delta));
    }
  }

  @Override
  public void absolute(String name, long value) {
    submit(new Absolute(name, value));
  }

  @Override
  public void total(String name, long value) {
    submit(new Total(name, value));
  }

  private void submit(Event event) {
    if (state.get() != State.RUNNING) {
      throw new IllegalStateException("StatsdBuffer is " + state.get() + "; cannot accept " + event.key());
    }
    Submit message = new Submit(event);
    enqueue(message);
    // The loop may have exited after the state check. Anything it did not drain is ours to reject.
    if (terminated.isDone() && queue.remove(message)) {
      throw new IllegalStateException("StatsdBuffer processing thread has exited; cannot accept "
          + event.key(), loopFailure());
    }
    metrics.incrementEventsEnqueued();
    metrics.recordQueueDepth(queue.size());
  }

  /**
   * Blocks while the queue is full. Gives up once the processing thread has exited,
   * since nothing would ever make room again.
   */
  private void enqueue(Message message) {
    try {
      while (!queue.offer(message, QUEUE_OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        if (terminated.isDone()) {
          throw new IllegalStateException("StatsdBuffer processing thread has exited", loopFailure());
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while enqueueing into StatsdBuffer", e);
    }
  }

  private Throwable loopFailure() {
    if (!terminated.isCompletedExceptionally()) {
      return null;
    }
    try {
      terminated.join();
      return null;
    } catch (CompletionException e) {
      return e.getCause();
    }
  }

  // ── Processing thread ───────────────────────────────────────────

  private void processLoop() {
    long nextFlush = System.nanoTime() + flushIntervalNanos;
    try {
      while (true) {
        long waitNanos = nextFlush - System.nanoTime();
        Message message = waitNanos > 0 ? queue.poll(waitNanos, TimeUnit.NANOSECONDS) : null;
        if (message instanceof Submit submit) {
          merge(submit.event());
        } else if (message instanceof CloseRequest request) {
          finalFlush(request);
          break;
        }
        long now = System.nanoTime();
        if (now - nextFlush >= 0) {
          periodicFlush();
          // Ticks missed during a slow flush are coalesced into the next one.
          long after = System.nanoTime();
          do {
            nextFlush += flushIntervalNanos;
          } while (after - nextFlush >= 0);
        }
      }
    } catch (Throwable fault) {
      onFault(fault);
      throw propagate(fault);
    }
    state.set(State.STOPPED);
    terminated.complete(null);
    discardPending(null);
    logger.log(Level.INFO, "StatsdBuffer stopped");
  }

  private void merge(Event event) {
    Event existing = events.get(event.key());
    if (existing == null) {
      events.put(event.key(), event);
    } else {
      try {
        existing.merge(event);
      } catch (IncompatibleEventException e) {
        logger.log(Level.WARNING, "Dropping event: {0}", e.getMessage());
        metrics.incrementEventsRejected();
      }
    }
    metrics.recordBufferedKeys(events.size());
    metrics.recordQueueDepth(queue.size());
  }

  private void periodicFlush() {
    try {
      flush();
    } catch (FlushException e) {
      logger.log(Level.WARNING, "Periodic flush incomplete: {0}", e.getMessage());
    }
  }

  private void finalFlush(CloseRequest request) {
    logger.log(Level.INFO, "Asked to terminate. Flushing {0} buffered keys before returning.", events.size());
    try {
      flush();
      request.reply().complete(null);
    } catch (FlushException e) {
      request.reply().completeExceptionally(e);
    }
  }

  private void onFault(Throwable fault) {
    state.set(State.STOPPED);
    logger.log(Level.SEVERE, "StatsdBuffer processing failed; flushing " + events.size()
        + " buffered keys before propagating", fault);
    try {
      flush();
    } catch (Throwable t) {
      fault.addSuppressed(t);
    }
    sendRemainingInline(fault);
    terminated.completeExceptionally(fault);
    discardPending(fault);
  }

  /**
   * Sends whatever the flush executor refused, from the processing thread itself.
   */
  private void sendRemainingInline(Throwable fault) {
    if (events.isEmpty()) {
      return;
    }
    logger.log(Level.WARNING, "Sending {0} keys the flush executor did not accept", events.size());
    List<Event> remaining = new ArrayList<>(events.values());
    events.clear();
    for (Event event : remaining) {
      try {
        transport.send(event);
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to send " + event.key(), e);
        fault.addSuppressed(e);
      }
    }
  }

  /**
   * Drops messages that arrived after the loop stopped taking them. A close request
   * found here can only exist after a fault, and is answered with it.
   */
  private void discardPending(Throwable fault) {
    List<Message> pending = new ArrayList<>();
    queue.drainTo(pending);
    int dropped = 0;
    for (Message message : pending) {
      if (message instanceof CloseRequest request) {
        request.reply().completeExceptionally(
            new IllegalStateException("StatsdBuffer processing thread has exited", fault));
      } else {
        dropped++;
      }
    }
    if (dropped > 0) {
      logger.log(Level.WARNING, "Discarded {0} events submitted after shutdown began", dropped);
      for (int i = 0; i < dropped; i++) {
        metrics.incrementEventsRejected();
      }
    }
    metrics.recordQueueDepth(0);
  }

  private static RuntimeException propagate(Throwable fault) {
    if (fault instanceof Error error) {
      throw error;
    }
    if (fault instanceof RuntimeException re) {
      return re;
    }
    return new IllegalStateException("StatsdBuffer processing failed", fault);
  }

  /**
   * Sends every buffered event and clears the map. Must only run on the processing thread.
   *
   * <p>An entry leaves the map only once its send has been handed to the flush executor,
   * so a failure part way through leaves the unsent entries buffered.
   *
   * @throws FlushException if any send failed; every event is consumed regardless
   */
  private void flush() {
    if (events.isEmpty()) {
      return;
    }
    long start = System.nanoTime();
    List<Event> batch = new ArrayList<>(events.size());
    List<Future<?>> sends = new ArrayList<>(events.size());
    Iterator<Event> buffered = events.values().iterator();
    while (buffered.hasNext()) {
      Event event = buffered.next();
      sends.add(flushExecutor.submit(() -> {
        transport.send(event);
        return null;
      }));
      batch.add(event);
      buffered.remove();
    }
    metrics.recordBufferedKeys(0);

    FlushException failure = null;
    int failed = 0;
    for (int i = 0; i < sends.size(); i++) {
      String key = batch.get(i).key();
      try {
        sends.get(i).get();
        metrics.incrementSendSuccess();
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        logger.log(Level.WARNING, "Failed to send " + key, cause);
        metrics.incrementSendFailure();
        failed++;
        if (failure == null) {
          failure = new FlushException("Failed to send " + key, cause);
        } else {
          failure.addSuppressed(cause);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        FlushException interrupted = new FlushException("Interrupted while waiting for sends", e);
        if (failure != null) {
          interrupted.addSuppressed(failure);
        }
        throw interrupted;
      }
    }
    metrics.recordFlushDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    if (failure != null) {
      logger.log(Level.WARNING, "Flush finished with {0} of {1} sends failed",
          new Object[]{failed, batch.size()});
      throw failure;
    }
  }

  // ── Shutdown ────────────────────────────────────────────────────

  /**
   * Flushes everything submitted before this call, then closes the transport.
   *
   * <p>Blocks until the processing thread has replied, or until the configured close
   * timeout elapses. The transport is closed only once no send is running; if sends are
   * still in flight when the timeout elapses it is left open and the returned failure
   * says so. Subsequent calls return immediately.
   *
   * @throws FlushException if the final flush failed, with any transport close failure
   *     suppressed; or if only the transport close failed
   * @throws IllegalStateException if the processing thread had already failed
   */
  @Override
  public void close() {
    if (!closeCalled.compareAndSet(false, true)) {
      return;
    }
    state.compareAndSet(State.RUNNING, State.DRAINING);

    long deadline = closeTimeout == null ? 0 : System.nanoTime() + closeTimeout.toNanos();
    RuntimeException failure = null;
    try {
      awaitFinalFlush();
    } catch (RuntimeException e) {
      failure = e;
    }

    flushExecutor.shutdown();
    if (!awaitSendsFinished(deadline)) {
      logger.log(Level.WARNING, "Sends still in flight after {0}; leaving transport open", closeTimeout);
      IllegalStateException open = new IllegalStateException("Transport left open: sends still in flight");
      if (failure == null) {
        failure = new FlushException("Final flush did not complete within " + closeTimeout, open);
      } else {
        failure.addSuppressed(open);
      }
    } else if (closeTransport) {
      try {
        transport.close();
      } catch (Exception e) {
        if (failure == null) {
          failure = new FlushException("Failed to close transport", e);
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * Waits for the processing thread and every flush thread to stop using the transport.
   * Without a close timeout the wait is unbounded.
   *
   * @return {@code false} if sends were still running at the deadline
   */
  private boolean awaitSendsFinished(long deadline) {
    try {
      if (closeTimeout == null) {
        processor.join();
        return flushExecutor.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
      }
      long remaining = deadline - System.nanoTime();
      if (remaining > 0) {
        TimeUnit.NANOSECONDS.timedJoin(processor, remaining);
      }
      remaining = Math.max(0, deadline - System.nanoTime());
      return flushExecutor.awaitTermination(remaining, TimeUnit.NANOSECONDS) && !processor.isAlive();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void awaitFinalFlush() {
    CloseRequest request = new CloseRequest(new CompletableFuture<>());
    if (!terminated.isDone()) {
      try {
        enqueue(request);
      } catch (IllegalStateException e) {
        // loop exited while we were waiting for room; terminated carries the reason
        logger.log(Level.FINE, "Close request not enqueued", e);
      }
    }
    CompletableFuture<Object> outcome = CompletableFuture.anyOf(request.reply(), terminated);
    try {
      if (closeTimeout == null) {
        outcome.get();
      } else {
        outcome.get(closeTimeout.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (ExecutionException e) {
      logger.log(Level.FINE, "Final flush completed exceptionally", e.getCause());
    } catch (TimeoutException e) {
      logger.log(Level.WARNING, "Final flush did not complete within {0}; interrupting processing thread",
          closeTimeout);
      processor.interrupt();
      flushExecutor.shutdownNow();
      throw new FlushException("Final flush did not complete within " + closeTimeout, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FlushException("Interrupted while waiting for final flush", e);
    }

    if (request.reply().isDone()) {
      try {
        request.reply().join();
        return;
      } catch (CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException re) {
          throw re;
        }
        throw new FlushException("Final flush failed", cause);
      }
    }
    throw new IllegalStateException("StatsdBuffer processing thread has exited", loopFailure());
  }

  /** Builder for {@link StatsdBuffer}. */
  public static final class Builder {
    private Transport transport;
    private Duration flushInterval = Duration.ofSeconds(1);
    private int queueCapacity = 100;
    private Duration closeTimeout;
    private boolean closeTransport = true;
    private MetricsExporter metrics;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the transport that receives aggregated events.
     *
     * <p><b>Required.</b> The buffer closes it on {@link StatsdBuffer#close()} unless
     * {@link #closeTransport(boolean)} says otherwise.
     *
     * @param transport the downstream transport
     * @return this builder
     */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets how often the buffered aggregates are flushed.
     *
     * <p>Optional. Defaults to {@code 1s}. Must be &gt; 0.
     *
     * @param flushInterval the flush interval
     * @return this builder
     */
    public Builder flushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
      return this;
    }

    /**
     * Sets the capacity of the submission queue. Callers block while it is full.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     *
     * @param queueCapacity maximum number of queued submissions
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Bounds how long {@link StatsdBuffer#close()} waits for the final flush.
     *
     * <p>Optional. By default close waits indefinitely. Must be &gt; 0 when set.
     *
     * @param closeTimeout maximum wait for the final flush
     * @return this builder
     */
    public Builder closeTimeout(Duration closeTimeout) {
      this.closeTimeout = closeTimeout;
      return this;
    }

    /**
     * Sets whether {@link StatsdBuffer#close()} closes the transport after the final flush.
     *
     * <p>Optional. Defaults to {@code true}. Pass {@code false} when the transport's
     * lifecycle is managed elsewhere, such as by a dependency injection container.
     *
     * @param closeTransport whether the buffer owns the transport
     * @return this builder
     */
    public Builder closeTransport(boolean closeTransport) {
      this.closeTransport = closeTransport;
      return this;
    }

    /**
     * Sets the metrics exporter for the buffer's own counters and gauges.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}. The buffer never closes the
     * exporter; its lifecycle belongs to the caller.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the buffer and starts its processing thread.
     *
     * @return a new running {@link StatsdBuffer}
     * @throws NullPointerException if {@code transport} or {@code flushInterval} is null
     * @throws IllegalArgumentException if {@code flushInterval}, {@code queueCapacity} or
     *     {@code closeTimeout} is not positive
     * @throws IllegalStateException if this builder was already used
     */
    public StatsdBuffer build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new StatsdBuffer(this);
    }
  }
}
