/**
 * Host layer versioned store.
 *
 * <p>{@link com.ryuqq.changecontrol.application.versioned.VersionedStore} drives the
 * engine against a {@link com.ryuqq.changecontrol.core.spi.ChangeControlStore}: it
 * supplies time, ids and committer, and serialises commits per container.</p>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
package com.ryuqq.changecontrol.application.versioned;
