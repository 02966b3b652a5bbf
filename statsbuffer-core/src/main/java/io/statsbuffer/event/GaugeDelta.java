package io.statsbuffer.event;

import java.util.List;

/**
 * Relative gauge adjustment. Deltas are summed and sent with an explicit sign,
 * which StatsD applies to the gauge's current value.
 */
public final class GaugeDelta implements Event {
  private final String name;
  private long value;

  public GaugeDelta(String name, long value) {
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
    value += EventNames.mergeable(this, other, GaugeDelta.class).value;
  }

  @Override
  public List<String> stats() {
    String sign = value < 0 ? "" : "+";
    return List.of(name + ":" + sign + value + "|g");
  }

  @Override
  public String toString() {
    return "GaugeDelta{" + name + "=" + value + "}";
  }
}
