package io.statsbuffer.event;

import java.util.List;

/**
 * Point-in-time reading. The latest value wins on merge.
 */
public final class Gauge implements Event {
  private final String name;
  private long value;

  public Gauge(String name, long value) {
    this.name = EventNames.require(name);
    this.value = value;
  }

  @Override
  public String name() {
    return name;
  }

  public long value() {
    return value;
  }

  @Override
  public String typeName() {
    return "g";
  }

  @Override
  public void merge(Event other) {
    value = EventNames.mergeable(this, other, Gauge.class).value;
  }

  @Override
  public List<String> stats() {
    // A negative absolute gauge would be read by StatsD as a delta; reset to 0 first.
    if (value < 0) {
      return List.of(name + ":0|g", name + ":" + value + "|g");
    }
    return List.of(name + ":" + value + "|g");
  }

  @Override
  public String toString() {
    return "Gauge{" + name + "=" + value + "}";
  }
}
