/**
 * Generic record patterns: parties, audit details, attestations and revision history.
 */
package com.ryuqq.changecontrol.core.generic;
