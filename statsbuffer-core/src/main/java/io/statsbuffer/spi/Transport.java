package io.statsbuffer.spi;

import io.statsbuffer.event.Event;

/**
 * Downstream sink that receives one aggregated event per key per flush.
 *
 * <p>Implementations own the wire concerns: connection setup, encoding the lines
 * returned by {@link Event#stats()}, and packet sizing.
 *
 * <h2>Threading</h2>
 * <p>{@link #send} is called concurrently from flush threads, once per buffered key.
 * {@link #close} is called at most once, and never while a send is running. A buffer
 * built with {@code closeTransport(false)} leaves closing to the transport's owner.
 *
 * <h2>Error Handling</h2>
 * <p>A failed send is logged and counted by the buffer. The event is not retried.
 *
 * @see io.statsbuffer.StatsdBuffer
 * @see LoggingTransport
 */
public interface Transport extends AutoCloseable {

  /**
   * Sends one aggregated event.
   *
   * @param event the merged event; must not be retained after this call returns
   * @throws Exception if the event could not be sent
   */
  void send(Event event) throws Exception;

  /**
   * Releases transport resources.
   *
   * @throws Exception if the transport could not be closed cleanly
   */
  @Override
  void close() throws Exception;
}
