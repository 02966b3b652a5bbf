package io.statsbuffer.event;

/**
 * Thrown when two events cannot be merged because their keys or kinds differ.
 */
public final class IncompatibleEventException extends IllegalArgumentException {

  public IncompatibleEventException(Event target, Event other) {
    super("Cannot merge " + other.getClass().getSimpleName() + " '" + other.key()
        + "' into " + target.getClass().getSimpleName() + " '" + target.key() + "'");
  }
}
