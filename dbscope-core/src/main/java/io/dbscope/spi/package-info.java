/**
 * Service Provider Interfaces for plugging connection pools into dbscope.
 *
 * @see io.dbscope.spi.PoolAdapter
 */
package io.dbscope.spi;
