package com.ryuqq.changecontrol.core.versioning;

import com.ryuqq.changecontrol.core.generic.AuditDetails;
import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;
import com.ryuqq.changecontrol.core.terminology.CodedText;

import java.util.Objects;
import java.util.Optional;

/**
 * 다른 시스템에서 복사해 온 {@link OriginalVersion}을 내용으로 갖는 버전.
 *
 * <p>import 행위 자체의 contribution, commit audit, signature를 따로 가집니다. 나머지
 * 조회는 감싼 original에 위임하며, original이 유일한 원본입니다.
 * imported version에는 attestation을 추가할 수 없습니다.</p>
 *
 * @param <T> payload 타입
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class ImportedVersion<T> extends Version<T> {

    private final OriginalVersion<T> item;

    private ImportedVersion(ObjectRef contribution, AuditDetails commitAudit, String signature, OriginalVersion<T> item) {
        super(contribution, commitAudit, signature);
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        this.item = item;
    }

    public static <T> ImportedVersion<T> of(ObjectRef contribution, AuditDetails commitAudit, OriginalVersion<T> item) {
        return new ImportedVersion<>(contribution, commitAudit, null, item);
    }

    public static <T> ImportedVersion<T> of(
        ObjectRef contribution,
        AuditDetails commitAudit,
        String signature,
        OriginalVersion<T> item
    ) {
        return new ImportedVersion<>(contribution, commitAudit, signature, item);
    }

    /**
     * import된 original 조회.
     *
     * @return 감싼 버전
     */
    public OriginalVersion<T> item() {
        return item;
    }

    @Override
    public ObjectVersionId uid() {
        return item.uid();
    }

    @Override
    public Optional<ObjectVersionId> precedingVersionUid() {
        return item.precedingVersionUid();
    }

    @Override
    public T data() {
        return item.data();
    }

    @Override
    public CodedText lifecycleState() {
        return item.lifecycleState();
    }

    @Override
    public HierObjectId ownerId() {
        return item.ownerId();
    }

    @Override
    public boolean isBranch() {
        return item.isBranch();
    }

    @Override
    public ImportedVersion<T> copy() {
        return new ImportedVersion<>(contribution(), commitAudit(), signature().orElse(null), item.copy());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ImportedVersion<?> that = (ImportedVersion<?>) o;
        return contribution().equals(that.contribution())
            && commitAudit().equals(that.commitAudit())
            && signature().equals(that.signature())
            && item.equals(that.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contribution(), commitAudit(), item);
    }

    @Override
    public String toString() {
        return "ImportedVersion{uid=" + uid() + ", contribution=" + contribution().id() + "}";
    }
}
