/**
 * Versions, version containers and contributions.
 *
 * <p>{@link com.ryuqq.changecontrol.core.versioning.VersionedObject} is the state machine
 * of this package. All commits are append only; a deletion is a new version whose
 * lifecycle state is {@code deleted}.</p>
 */
package com.ryuqq.changecontrol.core.versioning;
