/**
 * Identifier algebra: UIDs, container ids, version tree ids and version ids.
 *
 * <p>All identifiers are immutable value types with structural equality. Parsing never
 * normalises input; {@code toString()} returns the parsed text unchanged.</p>
 */
package com.ryuqq.changecontrol.core.identification;
