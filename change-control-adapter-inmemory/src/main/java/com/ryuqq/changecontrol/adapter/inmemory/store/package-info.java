/**
 * In-memory {@link com.ryuqq.changecontrol.core.spi.ChangeControlStore} implementation.
 *
 * <p>Thread safe and atomic per contribution, but not durable. Suitable for contract
 * tests, examples and single process tools.</p>
 *
 * @see com.ryuqq.changecontrol.core.spi.ChangeControlStore
 * @author Change Control Team
 * @since 1.0.0
 */
package com.ryuqq.changecontrol.adapter.inmemory.store;
