/**
 * Redis backend for shared stream queues, built on Spring Data Redis and Lettuce.
 *
 * @see io.streamqueue.redis.RedisSharedStore
 */
package io.streamqueue.redis;
