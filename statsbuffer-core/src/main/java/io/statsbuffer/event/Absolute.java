package io.statsbuffer.event;

import java.util.ArrayList;
import java.util.List;

/**
 * Absolute-valued metric that the server must not average. Merging replaces the
 * whole value set with the incoming one.
 */
public final class Absolute implements Event {
  private final String name;
  private List<Long> values;

  public Absolute(String name, long value) {
    this(name, List.of(value));
  }

  public Absolute(String name, List<Long> values) {
    this.name = EventNames.require(name);
    if (values.isEmpty()) {
      throw new IllegalArgumentException("values must not be empty");
    }
    this.values = List.copyOf(values);
  }

  @Override
  public String name() {
    return name;
  }

  public List<Long> values() {
    return values;
  }

  @Override
  public String typeName() {
    return "a";
  }

  @Override
  public void merge(Event other) {
    values = EventNames.mergeable(this, other, Absolute.class).values;
  }

  @Override
  public List<String> stats() {
    List<String> lines = new ArrayList<>(values.size());
    for (Long v : values) {
      lines.add(name + ":" + v + "|a");
    }
    return lines;
  }

  @Override
  public String toString() {
    return "Absolute{" + name + "=" + values + "}";
  }
}
