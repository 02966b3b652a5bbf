package io.statsbuffer.spi;

import io.statsbuffer.event.Event;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Transport} that writes each rendered StatsD line to a {@link Logger}.
 *
 * <p>Intended for development and tests where no StatsD daemon is available.
 */
public final class LoggingTransport implements Transport {
  private static final Logger logger = Logger.getLogger(LoggingTransport.class.getName());

  private final Level level;
  private volatile boolean closed;

  public LoggingTransport() {
    this(Level.INFO);
  }

  public LoggingTransport(Level level) {
    this.level = Objects.requireNonNull(level, "level");
  }

  @Override
  public void send(Event event) {
    if (closed) {
      throw new IllegalStateException("LoggingTransport has been closed");
    }
    for (String line : event.stats()) {
      logger.log(level, line);
    }
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
  }
}
