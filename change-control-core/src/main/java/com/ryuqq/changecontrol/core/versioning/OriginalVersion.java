package com.ryuqq.changecontrol.core.versioning;

import com.ryuqq.changecontrol.core.exception.EmptyCollectionException;
import com.ryuqq.changecontrol.core.exception.InvalidLifecycleStateException;
import com.ryuqq.changecontrol.core.generic.Attestation;
import com.ryuqq.changecontrol.core.generic.AuditDetails;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;
import com.ryuqq.changecontrol.core.spi.TerminologyValidator;
import com.ryuqq.changecontrol.core.terminology.CodeGroupCheck;
import com.ryuqq.changecontrol.core.terminology.CodedText;
import com.ryuqq.changecontrol.core.terminology.TerminologyGroup;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 로컬에서 생성한 내용과 선택적 attestation을 가진 버전.
 *
 * <p>생성 후 바뀌는 것은 attestation뿐입니다. {@link VersionedObject#commitAttestation}으로
 * 추가되며 제거되지 않습니다.</p>
 *
 * @param <T> payload 타입
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class OriginalVersion<T> extends Version<T> {

    private final ObjectVersionId uid;
    private final ObjectVersionId precedingVersionUid;
    private final Set<ObjectVersionId> otherInputVersionUids;
    private final CodedText lifecycleState;
    private final List<Attestation> attestations;
    private final T data;

    private OriginalVersion(Builder<T> builder, TerminologyValidator terminology) {
        super(builder.contribution, builder.commitAudit, builder.signature);
        if (builder.uid == null) {
            throw new IllegalArgumentException("uid cannot be null");
        }
        if (builder.lifecycleState == null) {
            throw new IllegalArgumentException("lifecycleState cannot be null");
        }
        if (builder.otherInputVersionUids != null && builder.otherInputVersionUids.isEmpty()) {
            throw new EmptyCollectionException("otherInputVersionUids must not be empty when provided");
        }
        if (builder.attestations != null && builder.attestations.isEmpty()) {
            throw new EmptyCollectionException("attestations must not be empty when provided");
        }
        CodeGroupCheck.requireCodeInGroup(
            terminology,
            builder.lifecycleState.definingCode(),
            TerminologyGroup.VERSION_LIFECYCLE_STATE,
            InvalidLifecycleStateException::new
        );
        this.uid = builder.uid;
        this.precedingVersionUid = builder.precedingVersionUid;
        this.otherInputVersionUids = builder.otherInputVersionUids == null
            ? null
            : Collections.unmodifiableSet(new LinkedHashSet<>(builder.otherInputVersionUids));
        this.lifecycleState = builder.lifecycleState;
        this.attestations = builder.attestations == null ? new ArrayList<>() : new ArrayList<>(builder.attestations);
        this.data = builder.data;
    }

    private OriginalVersion(OriginalVersion<T> source) {
        super(source.contribution(), source.commitAudit(), source.signature().orElse(null));
        this.uid = source.uid;
        this.precedingVersionUid = source.precedingVersionUid;
        this.otherInputVersionUids = source.otherInputVersionUids;
        this.lifecycleState = source.lifecycleState;
        this.attestations = new ArrayList<>(source.attestations);
        this.data = source.data;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    @Override
    public ObjectVersionId uid() {
        return uid;
    }

    @Override
    public Optional<ObjectVersionId> precedingVersionUid() {
        return Optional.ofNullable(precedingVersionUid);
    }

    /**
     * 이 버전에 병합된 다른 버전들의 ID.
     *
     * @return 삽입 순서를 유지하는 수정 불가능한 집합, 병합이 아니면 빈 집합
     */
    public Set<ObjectVersionId> otherInputVersionUids() {
        return otherInputVersionUids == null ? Set.of() : otherInputVersionUids;
    }

    public boolean isMerged() {
        return otherInputVersionUids != null;
    }

    @Override
    public CodedText lifecycleState() {
        return lifecycleState;
    }

    /**
     * 추가된 순서의 attestation 조회.
     *
     * @return 수정 불가능한 사본, attestation이 없으면 빈 리스트
     */
    public List<Attestation> attestations() {
        return List.copyOf(attestations);
    }

    public boolean hasAttestations() {
        return !attestations.isEmpty();
    }

    @Override
    public T data() {
        return data;
    }

    void appendAttestation(Attestation attestation) {
        if (attestation == null) {
            throw new IllegalArgumentException("attestation cannot be null");
        }
        attestations.add(attestation);
    }

    @Override
    public OriginalVersion<T> copy() {
        return new OriginalVersion<>(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OriginalVersion<?> that = (OriginalVersion<?>) o;
        return contribution().equals(that.contribution())
            && commitAudit().equals(that.commitAudit())
            && signature().equals(that.signature())
            && uid.equals(that.uid)
            && Objects.equals(precedingVersionUid, that.precedingVersionUid)
            && Objects.equals(otherInputVersionUids, that.otherInputVersionUids)
            && lifecycleState.equals(that.lifecycleState)
            && attestations.equals(that.attestations)
            && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, precedingVersionUid, lifecycleState, data);
    }

    @Override
    public String toString() {
        return "OriginalVersion{uid=" + uid + ", precedingVersionUid=" + precedingVersionUid
            + ", lifecycleState=" + lifecycleState.value() + "}";
    }

    /**
     * {@link OriginalVersion} Builder.
     *
     * @param <T> payload 타입
     */
    public static final class Builder<T> {

        private ObjectRef contribution;
        private AuditDetails commitAudit;
        private String signature;
        private ObjectVersionId uid;
        private ObjectVersionId precedingVersionUid;
        private Collection<ObjectVersionId> otherInputVersionUids;
        private CodedText lifecycleState;
        private List<Attestation> attestations;
        private T data;

        private Builder() {
        }

        public Builder<T> contribution(ObjectRef contribution) {
            this.contribution = contribution;
            return this;
        }

        public Builder<T> commitAudit(AuditDetails commitAudit) {
            this.commitAudit = commitAudit;
            return this;
        }

        public Builder<T> signature(String signature) {
            this.signature = signature;
            return this;
        }

        public Builder<T> uid(ObjectVersionId uid) {
            this.uid = uid;
            return this;
        }

        public Builder<T> precedingVersionUid(ObjectVersionId precedingVersionUid) {
            this.precedingVersionUid = precedingVersionUid;
            return this;
        }

        public Builder<T> otherInputVersionUids(Collection<ObjectVersionId> otherInputVersionUids) {
            this.otherInputVersionUids = otherInputVersionUids;
            return this;
        }

        public Builder<T> lifecycleState(CodedText lifecycleState) {
            this.lifecycleState = lifecycleState;
            return this;
        }

        public Builder<T> attestations(List<Attestation> attestations) {
            this.attestations = attestations;
            return this;
        }

        public Builder<T> data(T data) {
            this.data = data;
            return this;
        }

        /**
         * 검증 후 버전 생성.
         *
         * @param terminology lifecycle state 검사용 validator
         * @return OriginalVersion 인스턴스
         * @throws InvalidLifecycleStateException lifecycle state가 거부된 경우
         * @throws EmptyCollectionException otherInputVersionUids 또는 attestations가 주어졌지만 비어 있는 경우
         */
        public OriginalVersion<T> build(TerminologyValidator terminology) {
            return new OriginalVersion<>(this, terminology);
        }
    }
}
