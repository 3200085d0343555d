/**
 * Discovery of {@link io.dbscope.spi.PoolAdapter} implementations.
 *
 * @see io.dbscope.pool.PoolAdapters
 */
package io.dbscope.pool;
