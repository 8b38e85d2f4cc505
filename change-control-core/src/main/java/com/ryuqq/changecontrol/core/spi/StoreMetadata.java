package com.ryuqq.changecontrol.core.spi;

import com.ryuqq.changecontrol.core.identification.ObjectId;

import java.time.Instant;
import java.util.List;

/**
 * 저장 객체 하나의 저장소 메타데이터. 생성 시각과 이후 모든 행위를 오래된 순서로 담는다.
 *
 * @param objectId 저장 객체 (컨테이너, Contribution 또는 생성된 ID)
 * @param createdAt 객체가 Store에 처음 나타난 시각
 * @param actions 감사 이력 (오래된 순)
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record StoreMetadata(
    ObjectId objectId,
    Instant createdAt,
    List<StoreAction> actions
) {

    public StoreMetadata {
        if (objectId == null) {
            throw new IllegalArgumentException("objectId cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public long count(StoreActionType type) {
        return actions.stream().filter(action -> action.type() == type).count();
    }
}
