/**
 * In-memory KeyValueStore adapter implementation package.
 *
 * <p>This package provides a reference implementation of the
 * {@link com.ryuqq.flowgate.core.spi.KeyValueStore} SPI for tests, local runs and
 * single-process deployments where durability is not required.</p>
 *
 * @see com.ryuqq.flowgate.core.spi.KeyValueStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flowgate.adapter.inmemory.store;
