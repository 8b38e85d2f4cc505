package com.ryuqq.changecontrol.core.versioning;

import com.ryuqq.changecontrol.core.exception.ContainerMismatchException;
import com.ryuqq.changecontrol.core.exception.EmptyCollectionException;
import com.ryuqq.changecontrol.core.exception.NotAnOriginalVersionException;
import com.ryuqq.changecontrol.core.exception.PrecedenceViolationException;
import com.ryuqq.changecontrol.core.exception.VersionNotFoundException;
import com.ryuqq.changecontrol.core.generic.Attestation;
import com.ryuqq.changecontrol.core.generic.AuditDetails;
import com.ryuqq.changecontrol.core.generic.RevisionHistory;
import com.ryuqq.changecontrol.core.generic.RevisionHistoryItem;
import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;
import com.ryuqq.changecontrol.core.spi.ContainerHeader;
import com.ryuqq.changecontrol.core.spi.TerminologyValidator;
import com.ryuqq.changecontrol.core.terminology.CodedText;
import com.ryuqq.changecontrol.core.terminology.VersionLifecycleState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 버전 컨테이너. 논리적 기록 항목 하나의 추가 전용 이력.
 *
 * <p>버전은 커밋 순서대로 하나의 리스트에 보관되고, version id와 정확한 커밋 시각으로
 * 색인됩니다. 모든 커밋은 추가 전에 검사합니다:</p>
 * <ul>
 *   <li>새 버전의 object id는 컨테이너 uid와 같아야 함</li>
 *   <li>첫 버전은 preceding version이 없음</li>
 *   <li>이후 버전은 이미 보관 중인 preceding version을 지정해야 함</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> thread-safe하지 않습니다. 한 컨테이너의 커밋은 호출자가
 * 직렬화해야 하며, 서로 다른 컨테이너는 상태를 공유하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * VersionedObject&lt;Note&gt; container = VersionedObject.create(uid, ownerRef, now);
 * OriginalVersion&lt;Note&gt; v1 = container.commitOriginalVersion(
 *     contribution.ref(), v1Id, null, audit, VersionLifecycleState.COMPLETE.codedText(), note, terminology);
 * </pre>
 *
 * @param <T> payload 타입 (컨테이너는 내용을 해석하지 않음)
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class VersionedObject<T> {

    private final HierObjectId uid;
    private final ObjectRef ownerId;
    private final Instant timeCreated;

    private final List<Version<T>> versions = new ArrayList<>();
    private final Map<ObjectVersionId, Integer> idIndex = new HashMap<>();
    private final Map<Instant, Integer> timeIndex = new HashMap<>();
    // 버전마다 item 하나, 버전 handle과 같은 위치
    private final List<RevisionHistoryItem> historyItems = new ArrayList<>();
    private RevisionHistory historySnapshot = RevisionHistory.empty();

    private VersionedObject(HierObjectId uid, ObjectRef ownerId, Instant timeCreated) {
        if (uid == null) {
            throw new IllegalArgumentException("uid cannot be null");
        }
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId cannot be null");
        }
        if (timeCreated == null) {
            throw new IllegalArgumentException("timeCreated cannot be null");
        }
        this.uid = uid;
        this.ownerId = ownerId;
        this.timeCreated = timeCreated;
    }

    /**
     * 빈 컨테이너 생성.
     *
     * @param uid 컨테이너 ID
     * @param ownerId 소유 개체 (예: EHR)
     * @param timeCreated 생성 시각
     * @param <T> payload 타입
     * @return 빈 컨테이너
     */
    public static <T> VersionedObject<T> create(HierObjectId uid, ObjectRef ownerId, Instant timeCreated) {
        return new VersionedObject<>(uid, ownerId, timeCreated);
    }

    /**
     * 저장된 상태로 컨테이너 재구성.
     *
     * <p>버전을 주어진 순서대로 일반 커밋 검사를 거쳐 다시 커밋합니다. 재구성된 revision
     * history는 {@code revisionHistory}와 같아야 합니다.</p>
     *
     * @param header 컨테이너 header
     * @param revisionHistory 저장된 revision history
     * @param versions 커밋 순서의 저장된 버전
     * @param <T> payload 타입
     * @return 재구성된 컨테이너
     * @throws IllegalArgumentException revision history가 버전과 맞지 않는 경우
     * @throws ContainerMismatchException 다른 컨테이너의 버전이 섞인 경우
     * @throws PrecedenceViolationException 버전이 유효한 커밋 순서가 아닌 경우
     */
    public static <T> VersionedObject<T> restore(
        ContainerHeader header,
        RevisionHistory revisionHistory,
        List<? extends Version<T>> versions
    ) {
        if (header == null || revisionHistory == null || versions == null) {
            throw new IllegalArgumentException("header, revisionHistory and versions are required");
        }
        VersionedObject<T> container = new VersionedObject<>(header.uid(), header.ownerId(), header.timeCreated());
        for (Version<T> version : versions) {
            container.commit(version);
        }
        if (!container.revisionHistory().equals(revisionHistory)) {
            throw new IllegalArgumentException("Revision history of " + header.uid() + " does not match its versions");
        }
        return container;
    }

    public HierObjectId uid() {
        return uid;
    }

    public ObjectRef ownerId() {
        return ownerId;
    }

    public Instant timeCreated() {
        return timeCreated;
    }

    public ContainerHeader header() {
        return new ContainerHeader(uid, ownerId, timeCreated);
    }

    /**
     * 새 original version 커밋.
     *
     * @param contribution 버전이 속한 Contribution
     * @param newVersionUid 새 버전 ID
     * @param precedingVersionUid preceding version (첫 버전이면 null)
     * @param audit 커밋 감사 정보
     * @param lifecycleState lifecycle state 코드
     * @param data payload (null 가능)
     * @param terminology lifecycle state 검사용 validator
     * @return 커밋된 버전
     * @throws ContainerMismatchException newVersionUid가 다른 컨테이너에 속한 경우
     * @throws PrecedenceViolationException preceding version이 누락, 불필요, 또는 알 수 없는 경우
     * @throws com.ryuqq.changecontrol.core.exception.InvalidLifecycleStateException lifecycle state가 거부된 경우
     */
    public OriginalVersion<T> commitOriginalVersion(
        ObjectRef contribution,
        ObjectVersionId newVersionUid,
        ObjectVersionId precedingVersionUid,
        AuditDetails audit,
        CodedText lifecycleState,
        T data,
        TerminologyValidator terminology
    ) {
        return commitOriginal(contribution, newVersionUid, precedingVersionUid, audit, lifecycleState, data, null, terminology);
    }

    /**
     * 다른 버전을 병합한 새 original version 커밋.
     *
     * <p>병합 입력 버전의 존재 여부는 검사하지 않습니다. 다른 컨테이너나 시스템에 있을 수
     * 있습니다.</p>
     *
     * @param otherInputVersionUids 병합된 버전 ID (빈 값 불가)
     * @throws EmptyCollectionException otherInputVersionUids가 비어 있는 경우
     * @see #commitOriginalVersion
     */
    public OriginalVersion<T> commitOriginalMergedVersion(
        ObjectRef contribution,
        ObjectVersionId newVersionUid,
        ObjectVersionId precedingVersionUid,
        AuditDetails audit,
        CodedText lifecycleState,
        T data,
        Collection<ObjectVersionId> otherInputVersionUids,
        TerminologyValidator terminology
    ) {
        if (otherInputVersionUids == null) {
            throw new IllegalArgumentException("otherInputVersionUids cannot be null for a merged version");
        }
        if (otherInputVersionUids.isEmpty()) {
            throw new EmptyCollectionException("A merged version needs at least one other input version");
        }
        return commitOriginal(
            contribution, newVersionUid, precedingVersionUid, audit, lifecycleState, data, otherInputVersionUids, terminology
        );
    }

    /**
     * 다른 시스템에서 가져온 버전 커밋.
     *
     * <p>ID와 preceding version은 감싼 original에서 가져옵니다. 컨테이너는 original의
     * 분리된 사본을 보관하므로, 이후 호출자 인스턴스의 변경은 반영되지 않습니다.</p>
     *
     * @param contribution import의 Contribution
     * @param audit import 감사 기록
     * @param version import할 original
     * @return 커밋된 imported version
     */
    public ImportedVersion<T> commitImportedVersion(ObjectRef contribution, AuditDetails audit, OriginalVersion<T> version) {
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
        checkCommit(version.uid(), version.precedingVersionUid().orElse(null));
        ImportedVersion<T> imported = ImportedVersion.of(contribution, audit, version.copy());
        append(imported);
        return imported;
    }

    /**
     * 이 컨테이너의 original version에 attestation 추가.
     *
     * @param attestation 추가할 attestation
     * @param versionUid 증명 대상 버전
     * @throws VersionNotFoundException 이 컨테이너에 없는 버전인 경우
     * @throws NotAnOriginalVersionException imported version인 경우
     */
    public void commitAttestation(Attestation attestation, ObjectVersionId versionUid) {
        if (attestation == null) {
            throw new IllegalArgumentException("attestation cannot be null");
        }
        Version<T> target = versionWithId(versionUid);
        if (!(target instanceof OriginalVersion)) {
            throw new NotAnOriginalVersionException(
                "Cannot attest " + versionUid + ": it is not an original version"
            );
        }
        ((OriginalVersion<T>) target).appendAttestation(attestation);
        recordAudit(idIndex.get(versionUid), attestation);
    }

    /**
     * 이미 만들어진 버전 커밋 (예: 저장소에서 다시 읽은 버전).
     *
     * <p>다른 커밋과 같은 검사를 수행합니다. original version이 가진 attestation은 commit
     * audit 다음에 revision history에 기록됩니다.</p>
     *
     * @param version 커밋할 버전
     * @throws ContainerMismatchException 다른 컨테이너의 버전인 경우
     * @throws PrecedenceViolationException preceding version이 이 컨테이너에서 유효하지 않은 경우
     */
    public void commit(Version<T> version) {
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
        checkCommit(version.uid(), version.precedingVersionUid().orElse(null));
        append(version);
        if (version instanceof OriginalVersion) {
            for (Attestation attestation : ((OriginalVersion<T>) version).attestations()) {
                recordAudit(idIndex.get(version.uid()), attestation);
            }
        }
    }

    private OriginalVersion<T> commitOriginal(
        ObjectRef contribution,
        ObjectVersionId newVersionUid,
        ObjectVersionId precedingVersionUid,
        AuditDetails audit,
        CodedText lifecycleState,
        T data,
        Collection<ObjectVersionId> otherInputVersionUids,
        TerminologyValidator terminology
    ) {
        checkCommit(newVersionUid, precedingVersionUid);
        OriginalVersion<T> version = OriginalVersion.<T>builder()
            .contribution(contribution)
            .commitAudit(audit)
            .uid(newVersionUid)
            .precedingVersionUid(precedingVersionUid)
            .otherInputVersionUids(otherInputVersionUids)
            .lifecycleState(lifecycleState)
            .data(data)
            .build(terminology);
        append(version);
        return version;
    }

    private void checkCommit(ObjectVersionId newVersionUid, ObjectVersionId precedingVersionUid) {
        if (newVersionUid == null) {
            throw new IllegalArgumentException("newVersionUid cannot be null");
        }
        if (!newVersionUid.objectId().equals(uid.root())) {
            throw new ContainerMismatchException(
                "Version " + newVersionUid + " does not belong to versioned object " + uid
            );
        }
        if (idIndex.containsKey(newVersionUid)) {
            throw new PrecedenceViolationException(
                "Version " + newVersionUid + " already exists in versioned object " + uid
            );
        }
        if (versions.isEmpty()) {
            if (precedingVersionUid != null) {
                throw new PrecedenceViolationException(
                    "First version of " + uid + " cannot have a preceding version (" + precedingVersionUid + ")"
                );
            }
        } else {
            if (precedingVersionUid == null) {
                throw new PrecedenceViolationException(
                    "Version " + newVersionUid + " must name a preceding version: " + uid + " is not empty"
                );
            }
            if (!idIndex.containsKey(precedingVersionUid)) {
                throw new PrecedenceViolationException(
                    "Preceding version " + precedingVersionUid + " does not exist in versioned object " + uid
                );
            }
        }
    }

    private void append(Version<T> version) {
        int handle = versions.size();
        versions.add(version);
        idIndex.put(version.uid(), handle);
        // 같은 시각이면 나중 커밋이 우선
        timeIndex.put(version.commitAudit().timeCommitted(), handle);
        historyItems.add(RevisionHistoryItem.of(version.uid(), version.commitAudit()));
        historySnapshot = null;
    }

    private void recordAudit(int handle, AuditDetails audit) {
        historyItems.set(handle, historyItems.get(handle).appendAudit(audit));
        historySnapshot = null;
    }

    public int versionCount() {
        return versions.size();
    }

    /**
     * 커밋 순서의 모든 버전 ID.
     *
     * @return 수정 불가능한 리스트
     */
    public List<ObjectVersionId> allVersionIds() {
        List<ObjectVersionId> ids = new ArrayList<>(versions.size());
        for (Version<T> version : versions) {
            ids.add(version.uid());
        }
        return Collections.unmodifiableList(ids);
    }

    /**
     * 커밋 순서의 모든 버전.
     *
     * @return 수정 불가능한 리스트
     */
    public List<Version<T>> allVersions() {
        return List.copyOf(versions);
    }

    public boolean hasVersionId(ObjectVersionId versionUid) {
        return versionUid != null && idIndex.containsKey(versionUid);
    }

    /**
     * 정확히 {@code time}에 커밋된 버전이 있으면 true.
     *
     * @param time 커밋 시각
     * @return 정확히 일치하는지 여부
     */
    public boolean hasVersionAtTime(Instant time) {
        return time != null && timeIndex.containsKey(time);
    }

    /**
     * @throws VersionNotFoundException 해당 ID의 버전이 없는 경우
     */
    public Version<T> versionWithId(ObjectVersionId versionUid) {
        Integer handle = versionUid == null ? null : idIndex.get(versionUid);
        if (handle == null) {
            throw new VersionNotFoundException("Version " + versionUid + " not in versioned object " + uid);
        }
        return versions.get(handle);
    }

    /**
     * @throws VersionNotFoundException 정확히 그 시각에 커밋된 버전이 없는 경우
     */
    public Version<T> versionAtTime(Instant time) {
        Integer handle = time == null ? null : timeIndex.get(time);
        if (handle == null) {
            throw new VersionNotFoundException("No version committed at exactly " + time + " in versioned object " + uid);
        }
        return versions.get(handle);
    }

    /**
     * @throws VersionNotFoundException 해당 ID의 버전이 없는 경우
     */
    public boolean isOriginalVersion(ObjectVersionId versionUid) {
        return versionWithId(versionUid) instanceof OriginalVersion;
    }

    /**
     * trunk와 branch를 통틀어 가장 최근에 커밋된 버전.
     *
     * @return 최신 버전, 빈 컨테이너면 empty
     */
    public Optional<Version<T>> latestVersion() {
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    /**
     * 가장 최근에 커밋된 trunk 버전.
     *
     * @return tree id에 branch 부분이 없는 최신 버전
     */
    public Optional<Version<T>> latestTrunkVersion() {
        for (int i = versions.size() - 1; i >= 0; i--) {
            Version<T> version = versions.get(i);
            if (!version.isBranch()) {
                return Optional.of(version);
            }
        }
        return Optional.empty();
    }

    /**
     * 최신 trunk 버전의 lifecycle state.
     *
     * @return lifecycle state, trunk 버전이 없으면 empty
     */
    public Optional<CodedText> trunkLifecycleState() {
        return latestTrunkVersion().map(Version::lifecycleState);
    }

    /**
     * 최신 trunk 버전이 deleted 상태이면 true.
     *
     * @return 논리 삭제 여부
     */
    public boolean isLogicallyDeleted() {
        return trunkLifecycleState()
            .flatMap(VersionLifecycleState::fromCodedText)
            .filter(state -> state == VersionLifecycleState.DELETED)
            .isPresent();
    }

    /**
     * revision history의 불변 스냅샷. 이미 반환한 스냅샷은 이후 커밋의 영향을 받지 않는다.
     *
     * @return revision history (가장 최근 것이 마지막)
     */
    public RevisionHistory revisionHistory() {
        if (historySnapshot == null) {
            historySnapshot = RevisionHistory.of(historyItems);
        }
        return historySnapshot;
    }

    @Override
    public String toString() {
        return "VersionedObject{uid=" + uid + ", versionCount=" + versions.size() + "}";
    }
}
