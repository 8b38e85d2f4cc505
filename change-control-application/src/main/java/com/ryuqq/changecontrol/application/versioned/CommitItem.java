package com.ryuqq.changecontrol.application.versioned;

import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;
import com.ryuqq.changecontrol.core.terminology.CodedText;

import java.util.Optional;

/**
 * 여러 컨테이너에 걸친 커밋 안의 변경 하나. 새 컨테이너의 첫 버전이거나 기존 컨테이너의
 * 새 버전입니다.
 *
 * @param containerId 대상 컨테이너 (새 컨테이너면 null)
 * @param ownerId 새 컨테이너의 소유자 (update면 null)
 * @param payload payload (null 가능)
 * @param lifecycleState 새 버전의 lifecycle state
 * @param precedingVersionId update의 명시적 선행 버전 (가장 최근 버전이면 null)
 * @param <T> payload 타입
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record CommitItem<T>(
    HierObjectId containerId,
    ObjectRef ownerId,
    T payload,
    CodedText lifecycleState,
    ObjectVersionId precedingVersionId
) {

    public CommitItem {
        if (lifecycleState == null) {
            throw new IllegalArgumentException("lifecycleState cannot be null");
        }
        if ((containerId == null) == (ownerId == null)) {
            throw new IllegalArgumentException("Exactly one of containerId and ownerId must be given");
        }
        if (containerId == null && precedingVersionId != null) {
            throw new IllegalArgumentException("A new container has no preceding version");
        }
    }

    public static <T> CommitItem<T> create(ObjectRef ownerId, T payload, CodedText lifecycleState) {
        return new CommitItem<>(null, ownerId, payload, lifecycleState, null);
    }

    public static <T> CommitItem<T> update(HierObjectId containerId, T payload, CodedText lifecycleState) {
        return new CommitItem<>(containerId, null, payload, lifecycleState, null);
    }

    public static <T> CommitItem<T> update(
        HierObjectId containerId,
        T payload,
        CodedText lifecycleState,
        ObjectVersionId precedingVersionId
    ) {
        return new CommitItem<>(containerId, null, payload, lifecycleState, precedingVersionId);
    }

    public boolean isCreation() {
        return containerId == null;
    }

    public Optional<ObjectVersionId> preceding() {
        return Optional.ofNullable(precedingVersionId);
    }
}
