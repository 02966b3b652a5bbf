/**
 * Metric event kinds and their merge rules.
 *
 * <p>{@link io.statsbuffer.event.Event} is a sealed interface; each kind merges only with
 * events of the same kind and key. See {@link io.statsbuffer.event.Event} for the rules.
 *
 * @see io.statsbuffer.event.Event
 * @see io.statsbuffer.event.IncompatibleEventException
 */
package io.statsbuffer.event;
