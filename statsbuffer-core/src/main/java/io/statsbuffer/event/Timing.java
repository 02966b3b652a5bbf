package io.statsbuffer.event;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Distribution of duration samples in milliseconds.
 *
 * <p>Merging appends the incoming samples. The aggregate is rendered as count,
 * average, minimum and maximum. All samples are retained until the event is
 * flushed so that {@link #percentile(double)} can be computed exactly.
 */
public final class Timing implements Event {
  private final String name;
  private long count;
  private long sum;
  private long min;
  private long max;
  private long[] samples;

  public Timing(String name, long millis) {
    this.name = EventNames.require(name);
    if (millis < 0) {
      throw new IllegalArgumentException("millis must be >= 0");
    }
    this.count = 1;
    this.sum = millis;
    this.min = millis;
    this.max = millis;
    this.samples = new long[] {millis};
  }

  public Timing(String name, Duration duration) {
    this(name, duration.toMillis());
  }

  @Override
  public String name() {
    return name;
  }

  public long count() {
    return count;
  }

  public long sum() {
    return sum;
  }

  public long min() {
    return min;
  }

  public long max() {
    return max;
  }

  /** Integer average, truncated toward zero. */
  public long average() {
    return sum / count;
  }

  /**
   * Returns the nearest-rank percentile of the retained samples.
   *
   * @param percentile value in {@code (0, 100]}
   * @return the sample at the requested rank
   */
  public long percentile(double percentile) {
    if (!(percentile > 0 && percentile <= 100)) {
      throw new IllegalArgumentException("percentile must be in (0, 100]");
    }
    long[] sorted = Arrays.copyOf(samples, (int) count);
    Arrays.sort(sorted);
    int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
    return sorted[Math.max(rank, 1) - 1];
  }

  @Override
  public String typeName() {
    return "ms";
  }

  @Override
  public void merge(Event other) {
    Timing t = EventNames.mergeable(this, other, Timing.class);
    int needed = (int) (count + t.count);
    if (needed > samples.length) {
      samples = Arrays.copyOf(samples, Math.max(needed, samples.length * 2));
    }
    System.arraycopy(t.samples, 0, samples, (int) count, (int) t.count);
    count += t.count;
    sum += t.sum;
    min = Math.min(min, t.min);
    max = Math.max(max, t.max);
  }

  @Override
  public List<String> stats() {
    return List.of(
        name + ".count:" + count + "|c",
        name + ".avg:" + average() + "|ms",
        name + ".min:" + min + "|ms",
        name + ".max:" + max + "|ms");
  }

  @Override
  public String toString() {
    return "Timing{" + name + ", count=" + count + ", sum=" + sum + ", min=" + min + ", max=" + max + "}";
  }
}
