/**
 * Process-local stream queue backend.
 *
 * @see io.streamqueue.memory.MemoryStreamQueue
 */
package io.streamqueue.memory;
