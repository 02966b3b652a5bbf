package io.statsbuffer;

import java.time.Duration;

/**
 * {@link StatsdClient} that discards every metric. Useful when metrics are disabled.
 */
public final class NoopStatsdClient implements StatsdClient {

  @Override
  public void increment(String name, long delta) {
  }

  @Override
  public void decrement(String name, long delta) {
  }

  @Override
  public void timing(String name, Duration duration) {
  }

  @Override
  public void timing(String name, long millis) {
  }

  @Override
  public void gauge(String name, long value) {
  }

  @Override
  public void gaugeDelta(String name, long delta) {
  }

  @Override
  public void absolute(String name, long value) {
  }

  @Override
  public void total(String name, long value) {
  }

  @Override
  public void close() {
  }
}
