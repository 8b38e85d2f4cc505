package com.ryuqq.changecontrol.core.spi;

import com.ryuqq.changecontrol.core.generic.Attestation;
import com.ryuqq.changecontrol.core.generic.PartyProxy;
import com.ryuqq.changecontrol.core.identification.HierObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectId;
import com.ryuqq.changecontrol.core.identification.ObjectRef;
import com.ryuqq.changecontrol.core.identification.ObjectVersionId;
import com.ryuqq.changecontrol.core.versioning.Contribution;
import com.ryuqq.changecontrol.core.versioning.Version;
import com.ryuqq.changecontrol.core.versioning.VersionedObject;

import java.util.List;

/**
 * 버전 컨테이너와 Contribution을 위한 영속성 어댑터 SPI.
 *
 * <p>엔진은 컨테이너 상태를 메모리에만 보관하며, Store가 이를 영속화합니다. 컨테이너, 버전,
 * Contribution이 세션을 넘어 살아남는 곳은 Store뿐입니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>전역 고유 컨테이너 ID 생성</li>
 *   <li>컨테이너 생성 및 header와 revision history 반환</li>
 *   <li>Contribution과 그 버전 전체를 하나의 원자적 batch로 저장</li>
 *   <li>저장된 original version에 attestation 기록</li>
 *   <li>저장 객체별 접근 감사 이력 유지</li>
 * </ul>
 *
 * <p><strong>행위 주체:</strong> 모든 접근은 대신 행동하는 party를 지정하며, 호출자가 모르면
 * null입니다. 커밋과 attestation은 자신의 감사 기록에 있는 committer로 기록합니다.
 * actor가 없는 오버로드는 null을 전달합니다.</p>
 *
 * <p><strong>원자적 커밋:</strong></p>
 * <pre>
 * 1. ContributionBatch.verify(contribution, versions)   → InvalidContributionException
 * 2. 모든 버전이 컨테이너 커밋 검사 통과                  → ContainerMismatch / PrecedenceViolation
 * 3. Contribution과 버전을 함께 저장, 아니면 아무것도 저장하지 않음
 * </pre>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: 모든 메서드는 여러 스레드에서 호출될 수 있음</li>
 *   <li>격리: 주고받는 객체는 저장 데이터와 가변 상태를 공유하지 않아야 함</li>
 * </ul>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public interface ChangeControlStore {

    /**
     * 사용된 적 없는 새 컨테이너 ID 생성. 생성 사실도 감사 이력에 남는다.
     *
     * @param actor ID를 요청한 party (없으면 null)
     * @return 새 컨테이너 ID
     */
    HierObjectId generateContainerId(PartyProxy actor);

    default HierObjectId generateContainerId() {
        return generateContainerId(null);
    }

    /**
     * 빈 컨테이너 저장.
     *
     * @param header 컨테이너 메타데이터
     * @param actor 생성한 party (없으면 null)
     * @throws IllegalArgumentException header가 null인 경우
     * @throws com.ryuqq.changecontrol.core.exception.DuplicateObjectException uid가 이미 저장된 경우
     */
    void createContainer(ContainerHeader header, PartyProxy actor);

    default void createContainer(ContainerHeader header) {
        createContainer(header, null);
    }

    /**
     * 컨테이너 메타데이터와 revision history 조회.
     *
     * @param uid 컨테이너 ID
     * @param actor 조회하는 party (없으면 null)
     * @return header와 revision history
     * @throws com.ryuqq.changecontrol.core.exception.ContainerNotFoundException 저장된 컨테이너가 없는 경우
     */
    ContainerSnapshot retrieveContainer(HierObjectId uid, PartyProxy actor);

    default ContainerSnapshot retrieveContainer(HierObjectId uid) {
        return retrieveContainer(uid, null);
    }

    /**
     * 모든 버전을 포함한 컨테이너 전체 재구성.
     *
     * <p>payload 타입은 호출자가 지정하며 Store는 검사하지 않습니다.</p>
     *
     * @param uid 컨테이너 ID
     * @param actor 조회하는 party (없으면 null)
     * @param <T> payload 타입
     * @return 분리된 컨테이너
     * @throws com.ryuqq.changecontrol.core.exception.ContainerNotFoundException 저장된 컨테이너가 없는 경우
     */
    <T> VersionedObject<T> retrieveVersionedObject(HierObjectId uid, PartyProxy actor);

    default <T> VersionedObject<T> retrieveVersionedObject(HierObjectId uid) {
        return retrieveVersionedObject(uid, null);
    }

    /**
     * 저장된 버전 하나 조회.
     *
     * @param versionId version id
     * @param actor 조회하는 party (없으면 null)
     * @param <T> payload 타입
     * @return 분리된 버전 사본
     * @throws com.ryuqq.changecontrol.core.exception.ContainerNotFoundException 컨테이너가 저장되어 있지 않은 경우
     * @throws com.ryuqq.changecontrol.core.exception.VersionNotFoundException 버전이 저장되어 있지 않은 경우
     */
    <T> Version<T> retrieveVersion(ObjectVersionId versionId, PartyProxy actor);

    default <T> Version<T> retrieveVersion(ObjectVersionId versionId) {
        return retrieveVersion(versionId, null);
    }

    /**
     * 저장된 Contribution 조회.
     *
     * @param uid Contribution ID
     * @param actor 조회하는 party (없으면 null)
     * @return Contribution
     * @throws com.ryuqq.changecontrol.core.exception.ContributionNotFoundException 저장된 Contribution이 없는 경우
     */
    Contribution retrieveContribution(HierObjectId uid, PartyProxy actor);

    default Contribution retrieveContribution(HierObjectId uid) {
        return retrieveContribution(uid, null);
    }

    /**
     * Contribution과 버전을 원자적으로 저장.
     *
     * <p>버전은 여러 컨테이너에 걸칠 수 있습니다. 아직 없는 컨테이너는 {@code ownerId}가
     * 주어진 경우 Contribution 커밋 시각을 생성 시각으로 하여 생성합니다. 행위는
     * Contribution의 committer로 기록합니다.</p>
     *
     * @param contribution Contribution
     * @param versions 커밋 순서의 버전
     * @param ownerId 즉석에서 생성할 컨테이너의 소유자 (없으면 null)
     * @throws com.ryuqq.changecontrol.core.exception.InvalidContributionException batch가 일관되지 않은 경우
     * @throws com.ryuqq.changecontrol.core.exception.DuplicateObjectException Contribution uid가 이미 저장된 경우
     * @throws com.ryuqq.changecontrol.core.exception.ContainerNotFoundException 컨테이너가 없고 소유자도 주어지지 않은 경우
     */
    void commitContributionSet(Contribution contribution, List<? extends Version<?>> versions, ObjectRef ownerId);

    /**
     * 저장된 original version과 컨테이너 revision history에 attestation 추가.
     * 행위는 attestation의 committer로 기록한다.
     *
     * @param versionId 증명 대상 버전
     * @param attestation attestation
     * @throws com.ryuqq.changecontrol.core.exception.ContainerNotFoundException 컨테이너가 저장되어 있지 않은 경우
     * @throws com.ryuqq.changecontrol.core.exception.VersionNotFoundException 버전이 저장되어 있지 않은 경우
     * @throws com.ryuqq.changecontrol.core.exception.NotAnOriginalVersionException import된 버전인 경우
     */
    void addAttestation(ObjectVersionId versionId, Attestation attestation);

    /**
     * 저장 객체의 저장소 감사 이력 조회.
     *
     * <p>메타데이터 조회 자체도 기록됩니다.</p>
     *
     * @param objectId 컨테이너, Contribution 또는 생성된 ID
     * @param actor 조회하는 party (없으면 null)
     * @return 메타데이터 스냅샷
     * @throws com.ryuqq.changecontrol.core.exception.ContainerNotFoundException 해당 ID로 저장된 것이 없는 경우
     */
    StoreMetadata retrieveMetadata(ObjectId objectId, PartyProxy actor);

    default StoreMetadata retrieveMetadata(ObjectId objectId) {
        return retrieveMetadata(objectId, null);
    }
}
