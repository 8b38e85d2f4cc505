package com.ryuqq.changecontrol.core.spi;

import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;

import java.time.Instant;

/**
 * 버전을 제외한 버전 컨테이너 메타데이터.
 *
 * @param uid 컨테이너 ID
 * @param ownerId 소유 개체
 * @param timeCreated 생성 시각
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record ContainerHeader(
    HierObjectId uid,
    ObjectRef ownerId,
    Instant timeCreated
) {

    public ContainerHeader {
        if (uid == null) {
            throw new IllegalArgumentException("uid cannot be null");
        }
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId cannot be null");
        }
        if (timeCreated == null) {
            throw new IllegalArgumentException("timeCreated cannot be null");
        }
    }
}
