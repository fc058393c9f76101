/**
 * Spring Boot auto-configuration for stream queues, bound to {@code streamqueue.*} properties.
 */
package io.streamqueue.spring.boot;
