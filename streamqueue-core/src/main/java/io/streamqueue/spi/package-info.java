/**
 * Service Provider Interfaces for plugging in shared storage and metrics.
 *
 * @see io.streamqueue.spi.SharedStore
 * @see io.streamqueue.spi.MetricsExporter
 */
package io.streamqueue.spi;
