package com.ryuqq.changecontrol.application.versioned;

import com.ryuqq.changecontrol.core.generic.Attestation;
import com.ryuqq.changecontrol.core.generic.AuditDetails;
import com.ryuqq.changecontrol.core.generic.PartyProxy;
import com.ryuqq.changecontrol.core.generic.RevisionHistory;
import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;
import com.ryuqq.changecontrol.core.identification.Uid;
import com.ryuqq.changecontrol.core.identification.VersionTreeId;
import com.ryuqq.changecontrol.core.spi.ChangeControlStore;
import com.ryuqq.changecontrol.core.spi.ContainerHeader;
import com.ryuqq.changecontrol.core.spi.TerminologyValidator;
import com.ryuqq.changecontrol.core.terminology.AuditChangeType;
import com.ryuqq.changecontrol.core.terminology.CodedText;
import com.ryuqq.changecontrol.core.terminology.TextValue;
import com.ryuqq.changecontrol.core.terminology.VersionLifecycleState;
import com.ryuqq.changecontrol.core.versioning.Contribution;
import com.ryuqq.changecontrol.core.versioning.OriginalVersion;
import com.ryuqq.changecontrol.core.versioning.Version;
import com.ryuqq.changecontrol.core.versioning.VersionedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 버전 관리 레코드의 생성, 수정, 삭제, 증명을 위한 호스트 계층 진입점.
 *
 * <p>VersionedStore는 엔진이 호스트에 맡기는 일을 담당합니다. 시계를 읽고 새 version id를
 * 정하며 Contribution을 만들고, 컨테이너별로 커밋을 직렬화하여 {@link ChangeControlStore}에
 * 영속화합니다.</p>
 *
 * <p><strong>커밋 순서:</strong></p>
 * <pre>
 * 1. 대상 컨테이너 lock
 * 2. Store에서 컨테이너 로드
 * 3. 로드한 사본에 새 버전 커밋 → 엔진이 선행 관계 검사
 * 4. store.commitContributionSet(contribution, versions)
 * 5. unlock
 * </pre>
 *
 * <p><strong>버전 번호:</strong> 새 버전은 trunk에 놓이며, 컨테이너의 가장 높은 trunk 버전보다
 * 하나 큰 번호를 받습니다. 선행 버전의 기본값은 revision history의 가장 최근 버전입니다.</p>
 *
 * <p><strong>행위 주체:</strong> 쓰기는 committer 또는 attester로 Store에 기록되고, 읽기는
 * 선택적으로 reader를 받습니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 동시 사용에 안전합니다. 한 컨테이너의 커밋은
 * {@link ContainerLocks}로 직렬화되며 읽기는 lock을 잡지 않습니다.</p>
 *
 * @param <T> 이 Store가 보관하는 레코드의 payload 타입
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public class VersionedStore<T> {

    private static final Logger log = LoggerFactory.getLogger(VersionedStore.class);

    private final ChangeControlStore store;
    private final TerminologyValidator terminology;
    private final VersionedStoreConfig config;
    private final Clock clock;
    private final Uid systemUid;
    private final ContainerLocks locks;

    public VersionedStore(
        ChangeControlStore store,
        TerminologyValidator terminology,
        VersionedStoreConfig config,
        Clock clock
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (terminology == null) {
            throw new IllegalArgumentException("terminology cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.terminology = terminology;
        this.config = config;
        this.clock = clock;
        this.systemUid = Uid.parse(config.systemId());
        this.locks = new ContainerLocks(config.lockTimeoutMs());
    }

    /**
     * 버전 하나를 가진 새 컨테이너 생성.
     *
     * <p>version id는 {@code <new uid>::<systemId>::1}이며 change type은
     * <em>creation</em>입니다.</p>
     *
     * @param payload 첫 버전의 payload
     * @param ownerId 새 컨테이너의 소유 개체
     * @param committer 커밋하는 party
     * @param lifecycleState 첫 버전의 lifecycle state
     * @param description 선택 사유 (없으면 null)
     * @return 저장된 Contribution과 버전
     */
    public CommitResult<T> create(
        T payload,
        ObjectRef ownerId,
        PartyProxy committer,
        CodedText lifecycleState,
        TextValue description
    ) {
        return commit(
            committer,
            AuditChangeType.CREATION.codedText(),
            description,
            List.of(CommitItem.create(ownerId, payload, lifecycleState))
        );
    }

    /**
     * 기존 컨테이너에 새 trunk 버전 커밋.
     *
     * @param containerId 수정할 컨테이너
     * @param payload 새 payload
     * @param committer 커밋하는 party
     * @param lifecycleState 새 버전의 lifecycle state
     * @param changeType 감사 change type (예: modification, amendment)
     * @param precedingVersionId 명시적 선행 버전 (가장 최근 버전이면 null)
     * @param description 선택 사유 (없으면 null)
     * @return 저장된 Contribution과 버전
     * @throws com.ryuqq.changecontrol.core.exception.ContainerNotFoundException 컨테이너가 저장되어 있지 않은 경우
     * @throws com.ryuqq.changecontrol.core.exception.PrecedenceViolationException 선행 버전을 알 수 없는 경우
     */
    public CommitResult<T> update(
        HierObjectId containerId,
        T payload,
        PartyProxy committer,
        CodedText lifecycleState,
        CodedText changeType,
        ObjectVersionId precedingVersionId,
        TextValue description
    ) {
        return commit(
            committer,
            changeType,
            description,
            List.of(CommitItem.update(containerId, payload, lifecycleState, precedingVersionId))
        );
    }

    /**
     * payload 없이 <em>deleted</em> lifecycle state인 버전을 커밋하여 컨테이너를
     * 논리 삭제.
     *
     * @param containerId 삭제할 컨테이너
     * @param committer 커밋하는 party
     * @param description 선택 사유 (없으면 null)
     * @return 저장된 Contribution과 삭제 버전
     */
    public CommitResult<T> delete(HierObjectId containerId, PartyProxy committer, TextValue description) {
        return update(
            containerId,
            null,
            committer,
            VersionLifecycleState.DELETED.codedText(),
            AuditChangeType.DELETED.codedText(),
            null,
            description
        );
    }

    /**
     * 여러 변경(컨테이너에 걸칠 수 있음)을 하나의 Contribution으로 커밋.
     *
     * <p>관련된 모든 컨테이너는 커밋 내내 lock됩니다. 새 컨테이너는 모든 버전이 엔진 검사를
     * 통과한 뒤에야 Store에 생성됩니다.</p>
     *
     * @param committer 커밋하는 party
     * @param changeType Contribution과 버전의 감사 change type
     * @param description 선택 사유 (없으면 null)
     * @param items 커밋 순서의 변경
     * @return 저장된 Contribution과 item 순서의 버전
     */
    public CommitResult<T> commit(
        PartyProxy committer,
        CodedText changeType,
        TextValue description,
        List<CommitItem<T>> items
    ) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("items cannot be null or empty");
        }

        List<HierObjectId> targets = new ArrayList<>(items.size());
        for (CommitItem<T> item : items) {
            if (item == null) {
                throw new IllegalArgumentException("items cannot contain null");
            }
            targets.add(item.isCreation() ? store.generateContainerId(committer) : item.containerId());
        }

        try (ContainerLocks.Held held = locks.acquire(targets)) {
            Instant now = clock.instant();
            AuditDetails audit = AuditDetails.of(config.systemId(), now, changeType, description, committer, terminology);
            HierObjectId contributionUid = store.generateContainerId(committer);
            ObjectRef contributionRef = ObjectRef.contribution(contributionUid);

            Map<HierObjectId, VersionedObject<T>> working = new LinkedHashMap<>();
            List<ContainerHeader> newContainers = new ArrayList<>();
            List<Version<T>> versions = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                CommitItem<T> item = items.get(i);
                HierObjectId uid = targets.get(i);
                VersionedObject<T> container = working.get(uid);
                if (container == null) {
                    if (item.isCreation()) {
                        container = VersionedObject.create(uid, item.ownerId(), now);
                        newContainers.add(container.header());
                    } else {
                        container = store.retrieveVersionedObject(uid, committer);
                    }
                    working.put(uid, container);
                }
                versions.add(commitNext(container, item, contributionRef, audit));
            }

            List<ObjectRef> refs = new ArrayList<>(versions.size());
            for (Version<T> version : versions) {
                refs.add(Contribution.versionRef(version.uid()));
            }
            Contribution contribution = Contribution.of(contributionUid, refs, audit);

            for (ContainerHeader header : newContainers) {
                store.createContainer(header, committer);
            }
            store.commitContributionSet(contribution, versions, null);

            log.info("Committed contribution {} ({}) with {} version(s)",
                contributionUid, changeType.value(), versions.size());
            return new CommitResult<>(contribution, versions);
        }
    }

    private OriginalVersion<T> commitNext(
        VersionedObject<T> container,
        CommitItem<T> item,
        ObjectRef contributionRef,
        AuditDetails audit
    ) {
        ObjectVersionId preceding = item.preceding().orElseGet(() -> container.revisionHistory().isEmpty()
            ? null
            : container.revisionHistory().mostRecentVersion());
        ObjectVersionId newVersionId = ObjectVersionId.of(container.uid(), systemUid, nextTrunk(container));
        log.debug("Committing {} on {} (preceding {})", newVersionId, container.uid(), preceding);
        return container.commitOriginalVersion(
            contributionRef,
            newVersionId,
            preceding,
            audit,
            item.lifecycleState(),
            item.payload(),
            terminology
        );
    }

    private static VersionTreeId nextTrunk(VersionedObject<?> container) {
        long highest = 0;
        for (ObjectVersionId id : container.allVersionIds()) {
            highest = Math.max(highest, id.versionTreeId().trunkVersion());
        }
        return VersionTreeId.trunk(highest + 1);
    }

    /**
     * 저장된 original version 증명.
     *
     * @param versionId 증명할 버전
     * @param request 증명 내용과 증명자
     * @return 저장된 attestation
     * @throws com.ryuqq.changecontrol.core.exception.VersionNotFoundException 버전이 저장되어 있지 않은 경우
     * @throws com.ryuqq.changecontrol.core.exception.NotAnOriginalVersionException import된 버전인 경우
     */
    public Attestation attest(ObjectVersionId versionId, AttestationRequest request) {
        if (versionId == null) {
            throw new IllegalArgumentException("versionId cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        HierObjectId containerId = HierObjectId.of(versionId.objectId());
        try (ContainerLocks.Held held = locks.acquire(List.of(containerId))) {
            Attestation attestation = Attestation.builder()
                .systemId(config.systemId())
                .timeCommitted(clock.instant())
                .committer(request.attester())
                .description(request.description())
                .reason(request.reason())
                .pending(request.pending())
                .attestedView(request.attestedView())
                .proof(request.proof())
                .items(request.items())
                .build(terminology);

            VersionedObject<T> container = store.retrieveVersionedObject(containerId, request.attester());
            container.commitAttestation(attestation, versionId);
            store.addAttestation(versionId, attestation);

            log.info("Attested {} ({})", versionId, request.reason().value());
            return attestation;
        }
    }

    /**
     * 컨테이너에서 가장 최근에 커밋된 버전 (trunk 또는 branch).
     */
    public Optional<Version<T>> readLatest(HierObjectId containerId) {
        return readLatest(containerId, null);
    }

    /**
     * {@code reader}를 대신하여 조회한, 컨테이너의 가장 최근 커밋 버전.
     *
     * @param containerId 조회할 컨테이너
     * @param reader Store 행위 이력에 기록할 party (없으면 null)
     * @return 최신 버전 (빈 컨테이너면 empty)
     */
    public Optional<Version<T>> readLatest(HierObjectId containerId, PartyProxy reader) {
        return store.<T>retrieveVersionedObject(containerId, reader).latestVersion();
    }

    public Optional<Version<T>> readLatestTrunk(HierObjectId containerId) {
        return readLatestTrunk(containerId, null);
    }

    public Optional<Version<T>> readLatestTrunk(HierObjectId containerId, PartyProxy reader) {
        return store.<T>retrieveVersionedObject(containerId, reader).latestTrunkVersion();
    }

    public Version<T> readVersion(ObjectVersionId versionId) {
        return readVersion(versionId, null);
    }

    public Version<T> readVersion(ObjectVersionId versionId, PartyProxy reader) {
        return store.retrieveVersion(versionId, reader);
    }

    public VersionedObject<T> retrieveVersionedObject(HierObjectId containerId) {
        return retrieveVersionedObject(containerId, null);
    }

    public VersionedObject<T> retrieveVersionedObject(HierObjectId containerId, PartyProxy reader) {
        return store.retrieveVersionedObject(containerId, reader);
    }

    public RevisionHistory revisionHistory(HierObjectId containerId) {
        return revisionHistory(containerId, null);
    }

    public RevisionHistory revisionHistory(HierObjectId containerId, PartyProxy reader) {
        return store.retrieveContainer(containerId, reader).revisionHistory();
    }

    /**
     * 컨테이너의 최신 trunk 버전이 deleted 상태이면 true.
     */
    public boolean isLogicallyDeleted(HierObjectId containerId) {
        return store.<T>retrieveVersionedObject(containerId).isLogicallyDeleted();
    }

    public VersionedStoreConfig config() {
        return config;
    }
}
