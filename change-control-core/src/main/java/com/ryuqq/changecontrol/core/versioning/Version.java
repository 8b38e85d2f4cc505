package com.ryuqq.changecontrol.core.versioning;

import com.ryuqq.changecontrol.core.codec.ChangeControlJson;
import com.ryuqq.changecontrol.core.generic.AuditDetails;
import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;
import com.ryuqq.changecontrol.core.terminology.CodedText;

import java.util.Optional;

/**
 * 버전 관리 대상 항목의 불변 스냅샷 하나.
 *
 * <p>버전은 로컬에서 만든 {@link OriginalVersion}이거나 다른 시스템에서 복사해 온
 * {@link ImportedVersion}입니다. 둘 다 같은 조회 메서드를 제공하며, imported version은
 * 감싼 original에 위임합니다.</p>
 *
 * <p><strong>모든 버전이 직접 가지는 필드:</strong></p>
 * <ul>
 *   <li><strong>contribution:</strong> 이 버전을 커밋한 Contribution 참조</li>
 *   <li><strong>commitAudit:</strong> 커밋 감사 기록</li>
 *   <li><strong>signature:</strong> {@link #canonicalForm()}에 대한 서명 (선택)</li>
 * </ul>
 *
 * @param <T> payload 타입 (엔진은 내용을 해석하지 않음)
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public abstract sealed class Version<T> permits OriginalVersion, ImportedVersion {

    private final ObjectRef contribution;
    private final AuditDetails commitAudit;
    private final String signature;

    Version(ObjectRef contribution, AuditDetails commitAudit, String signature) {
        if (contribution == null) {
            throw new IllegalArgumentException("contribution cannot be null");
        }
        if (commitAudit == null) {
            throw new IllegalArgumentException("commitAudit cannot be null");
        }
        if (signature != null && signature.isEmpty()) {
            throw new IllegalArgumentException("signature must not be empty when provided");
        }
        this.contribution = contribution;
        this.commitAudit = commitAudit;
        this.signature = signature;
    }

    public ObjectRef contribution() {
        return contribution;
    }

    public AuditDetails commitAudit() {
        return commitAudit;
    }

    public Optional<String> signature() {
        return Optional.ofNullable(signature);
    }

    /**
     * 버전 고유 식별자.
     *
     * @return version id
     */
    public abstract ObjectVersionId uid();

    /**
     * 이 버전이 파생된 버전. 컨테이너의 첫 버전에서만 없음.
     *
     * @return preceding version id
     */
    public abstract Optional<ObjectVersionId> precedingVersionUid();

    /**
     * 버전 payload 조회.
     *
     * @return payload (삭제 버전 등에서는 null 가능)
     */
    public abstract T data();

    public abstract CodedText lifecycleState();

    /**
     * 이 버전이 속한 컨테이너 ID ({@link #uid()}에서 도출).
     *
     * @return 컨테이너 ID
     */
    public HierObjectId ownerId() {
        return HierObjectId.of(uid().objectId());
    }

    public boolean isBranch() {
        return uid().isBranch();
    }

    /**
     * signature를 뺀 모든 필드를 담은 버전의 정규 직렬화.
     *
     * <p>같은 버전이면 바이트 단위로 같으며, 서명과 해시의 입력으로 사용합니다.</p>
     *
     * @return 정규 JSON
     */
    public String canonicalForm() {
        return ChangeControlJson.canonicalForm(this);
    }

    /**
     * 가변 상태를 공유하지 않는 분리된 사본. payload는 공유한다.
     *
     * @return 버전 사본
     */
    public abstract Version<T> copy();
}
