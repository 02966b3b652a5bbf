package io.statsbuffer.event;

import java.util.Objects;

final class EventNames {

  private EventNames() {}

  static String require(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name must not be empty");
    }
    return name;
  }

  /**
   * Returns {@code other} cast to {@code kind} if it can merge into {@code target}.
   */
  static <E extends Event> E mergeable(Event target, Event other, Class<E> kind) {
    Objects.requireNonNull(other, "other");
    if (!kind.isInstance(other) || !target.key().equals(other.key())) {
      throw new IncompatibleEventException(target, other);
    }
    return kind.cast(other);
  }
}
