/**
 * Service provider interfaces: terminology validation and persistence.
 *
 * <p>Implementations live outside the core. {@link com.ryuqq.changecontrol.core.spi.ContributionBatch}
 * holds the batch check every store runs before an atomic commit.</p>
 */
package com.ryuqq.changecontrol.core.spi;
