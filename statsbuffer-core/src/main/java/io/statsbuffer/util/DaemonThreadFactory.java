package io.statsbuffer.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory that creates named daemon threads with a sequential suffix.
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, etc. and do not prevent
 * JVM shutdown. Exceptions that escape a thread are reported to
 * {@link java.util.logging} at {@code SEVERE} unless another handler is given.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private static final Thread.UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, error) -> logger.log(Level.SEVERE, "Uncaught exception in thread " + thread.getName(), error);

  private final String prefix;
  private final Thread.UncaughtExceptionHandler handler;
  private final AtomicInteger counter = new AtomicInteger(1);

  public DaemonThreadFactory(String prefix) {
    this(prefix, LOGGING_HANDLER);
  }

  public DaemonThreadFactory(String prefix, Thread.UncaughtExceptionHandler handler) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
    this.handler = Objects.requireNonNull(handler, "handler");
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(handler);
    return thread;
  }
}
