package com.ryuqq.changecontrol.core.versioning;

import com.ryuqq.changecontrol.core.exception.EmptyCollectionException;
import com.ryuqq.changecontrol.core.generic.AuditDetails;
import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;

import java.util.List;

/**
 * 변경 집합. 하나의 원자적 행위로 함께 커밋된 버전들.
 *
 * <p>커밋 batch 검사에 필요한 데이터를 담지만 검사 자체는 하지 않습니다.
 * {@link com.ryuqq.changecontrol.core.spi.ContributionBatch} 참고.</p>
 *
 * @param uid Contribution ID
 * @param versions 커밋된 버전 참조 (빈 값 불가)
 * @param audit Contribution 전체의 감사 기록
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record Contribution(
    HierObjectId uid,
    List<ObjectRef> versions,
    AuditDetails audit
) {

    public static final String VERSION_REF_TYPE = "VERSION";

    public Contribution {
        if (uid == null) {
            throw new IllegalArgumentException("uid cannot be null");
        }
        if (versions == null) {
            throw new IllegalArgumentException("versions cannot be null");
        }
        if (versions.isEmpty()) {
            throw new EmptyCollectionException("Contribution " + uid + " must reference at least one version");
        }
        if (audit == null) {
            throw new IllegalArgumentException("audit cannot be null");
        }
        versions = List.copyOf(versions);
    }

    public static Contribution of(HierObjectId uid, List<ObjectRef> versions, AuditDetails audit) {
        return new Contribution(uid, versions, audit);
    }

    /**
     * {@link #versions()}에 저장되는 형태의 버전 참조 생성.
     *
     * @param versionId version id
     * @return local VERSION 참조
     */
    public static ObjectRef versionRef(ObjectVersionId versionId) {
        return ObjectRef.of(ObjectRef.LOCAL_NAMESPACE, VERSION_REF_TYPE, versionId);
    }

    /**
     * 각 버전이 가지는 형태의 Contribution 참조.
     *
     * @return CONTRIBUTION 참조
     */
    public ObjectRef ref() {
        return ObjectRef.contribution(uid);
    }
}
