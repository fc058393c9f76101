/**
 * Micrometer bridge for stream queue metrics.
 *
 * @see io.streamqueue.micrometer.MicrometerMetricsExporter
 */
package io.streamqueue.micrometer;
