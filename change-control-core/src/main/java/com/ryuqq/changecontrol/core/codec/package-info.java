/**
 * JSON shapes and canonical form of versions and related records.
 */
package com.ryuqq.changecontrol.core.codec;
