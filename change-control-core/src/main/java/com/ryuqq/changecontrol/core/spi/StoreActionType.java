package com.ryuqq.changecontrol.core.spi;

/**
 * Store 감사 이력에 기록되는 접근 종류.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public enum StoreActionType {

    CREATE,
    READ,
    UPDATE,
    GENERATE_ID,
    READ_METADATA,
    UPDATE_VERSION_ATTESTATIONS
}
