package io.statsbuffer.event;

import java.util.List;

/**
 * Monotonic running total, e.g. read operations since boot. The latest total wins on merge.
 */
public final class Total implements Event {
  private final String name;
  private long value;

  public Total(String name, long value) {
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
    return "t";
  }

  @Override
  public void merge(Event other) {
    value = EventNames.mergeable(this, other, Total.class).value;
  }

  @Override
  public List<String> stats() {
    return List.of(name + ":" + value + "|t");
  }

  @Override
  public String toString() {
    return "Total{" + name + "=" + value + "}";
  }
}
