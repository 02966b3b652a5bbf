package io.statsbuffer.event;

import java.util.List;

/**
 * Counter delta. Merging sums the deltas, so negative values act as decrements.
 */
public final class Increment implements Event {
  private final String name;
  private long value;

  public Increment(String name, long value) {
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
    return "c";
  }

  @Override
  public void merge(Event other) {
    value += EventNames.mergeable(this, other, Increment.class).value;
  }

  @Override
  public List<String> stats() {
    return List.of(name + ":" + value + "|c");
  }

  @Override
  public String toString() {
    return "Increment{" + name + "=" + value + "}";
  }
}
