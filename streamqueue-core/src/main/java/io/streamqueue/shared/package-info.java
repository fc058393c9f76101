/**
 * Cross-process stream queue backend written against the
 * {@link io.streamqueue.spi.SharedStore} SPI.
 *
 * <p>{@link io.streamqueue.shared.SharedStreamQueue} maps a run onto an expiring list plus a
 * notification channel; {@link io.streamqueue.shared.KeyNames} derives their keys.
 *
 * @see io.streamqueue.shared.SharedStreamQueueFactory
 */
package io.streamqueue.shared;
