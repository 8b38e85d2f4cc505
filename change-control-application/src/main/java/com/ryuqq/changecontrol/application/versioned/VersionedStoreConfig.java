package com.ryuqq.changecontrol.application.versioned;

import com.ryuqq.changecontrol.core.identification.Uid;

/**
 * VersionedStore 설정 (불변 Record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>systemId: 이 시스템의 ID. 모든 version id와 감사 기록에 쓰이며 UID여야 함</li>
 *   <li>lockTimeoutMs: 커밋이 컨테이너 lock을 기다리는 시간 (기본 5000ms)</li>
 * </ul>
 *
 * @author Change Control Team
 * @since 1.0.0
 * @param systemId 생성 시스템 ID (예: {@code net.example.ehr})
 * @param lockTimeoutMs lock 대기 한도 (밀리초, 양수)
 */
public record VersionedStoreConfig(String systemId, long lockTimeoutMs) {

    public static final long DEFAULT_LOCK_TIMEOUT_MS = 5000;

    /**
     * 기본 lock timeout을 사용하는 설정.
     *
     * @param systemId 생성 시스템 ID
     */
    public VersionedStoreConfig(String systemId) {
        this(systemId, DEFAULT_LOCK_TIMEOUT_MS);
    }

    /**
     * Compact Constructor (검증).
     *
     * @throws IllegalArgumentException systemId가 UID가 아니거나 lockTimeoutMs가 양수가 아닌 경우
     */
    public VersionedStoreConfig {
        if (systemId == null || systemId.isBlank()) {
            throw new IllegalArgumentException("systemId cannot be null or blank");
        }
        if (!Uid.isValid(systemId)) {
            throw new IllegalArgumentException("systemId must be a UID (current: " + systemId + ")");
        }
        if (lockTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "lockTimeoutMs must be positive (current: " + lockTimeoutMs + ")"
            );
        }
    }

    public VersionedStoreConfig withSystemId(String systemId) {
        return new VersionedStoreConfig(systemId, this.lockTimeoutMs);
    }

    public VersionedStoreConfig withLockTimeoutMs(long lockTimeoutMs) {
        return new VersionedStoreConfig(this.systemId, lockTimeoutMs);
    }
}
