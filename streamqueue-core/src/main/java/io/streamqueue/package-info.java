/**
 * Ordered, multi-consumer event logs keyed by run id, with live tailing and cooperative
 * cancellation.
 *
 * <p>Entry points:
 * <ul>
 *   <li>{@link io.streamqueue.StreamQueueManager}: per-process registry of queues</li>
 *   <li>{@link io.streamqueue.StreamQueue}: push, snapshot, clear, cancel, copy, live tail</li>
 *   <li>{@link io.streamqueue.LiveTail}: blocking iterator over a queue's items</li>
 *   <li>{@link io.streamqueue.EventMessage}: the unit of data, including control events</li>
 * </ul>
 */
package io.streamqueue;
