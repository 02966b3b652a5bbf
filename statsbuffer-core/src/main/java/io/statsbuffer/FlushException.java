package io.statsbuffer;

/**
 * Thrown when a flush or the shutdown of the transport did not complete cleanly.
 *
 * <p>The cause is the first failure encountered. Further failures from the same
 * flush, and a failure to close the transport afterwards, are attached as
 * {@linkplain Throwable#getSuppressed() suppressed} exceptions.
 */
public class FlushException extends RuntimeException {

  public FlushException(String message) {
    super(message);
  }

  public FlushException(String message, Throwable cause) {
    super(message, cause);
  }
}
