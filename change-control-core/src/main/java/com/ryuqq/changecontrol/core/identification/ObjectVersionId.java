package com.ryuqq.changecontrol.core.identification;

import com.ryuqq.changecontrol.core.exception.InvalidObjectVersionIdException;
import com.ryuqq.changecontrol.core.exception.InvalidUidFormatException;
import com.ryuqq.changecontrol.core.exception.InvalidVersionTreeIdException;

/**
 * VersionedObject의 한 버전을 가리키는 전역 고유 식별자.
 *
 * <p>어휘 형식: {@code object_id::creating_system_id::version_tree_id}
 * (예: {@code 154b1047-23aa-4d4d-8713-df848fd4d60a::net.example.ehr::2}).</p>
 *
 * <ul>
 *   <li><strong>object_id:</strong> 소속 컨테이너의 uid ({@link #root()})</li>
 *   <li><strong>creating_system_id:</strong> 버전을 만든 시스템의 UID</li>
 *   <li><strong>version_tree_id:</strong> version tree 내 위치</li>
 * </ul>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class ObjectVersionId extends UidBasedId {

    private final Uid creatingSystemId;
    private final VersionTreeId versionTreeId;

    private ObjectVersionId(String value) {
        super(value);
        String[] parts = extension().split(SEPARATOR, -1);
        if (parts.length != 2) {
            throw new InvalidObjectVersionIdException(
                "ObjectVersionId must be of the form object_id::creating_system_id::version_tree_id: '" + value + "'"
            );
        }
        try {
            this.creatingSystemId = Uid.parse(parts[0]);
        } catch (InvalidUidFormatException e) {
            throw new InvalidObjectVersionIdException("Creating system id of '" + value + "' is not a valid UID", e);
        }
        try {
            this.versionTreeId = VersionTreeId.of(parts[1]);
        } catch (InvalidVersionTreeIdException e) {
            throw new InvalidObjectVersionIdException("Version tree id of '" + value + "' is not valid", e);
        }
    }

    /**
     * ObjectVersionId 파싱.
     *
     * @param value 어휘 값
     * @return ObjectVersionId 인스턴스
     * @throws InvalidUidFormatException object id 부분이 UID가 아닌 경우
     * @throws InvalidObjectVersionIdException extension 형식이 잘못된 경우
     */
    public static ObjectVersionId of(String value) {
        return new ObjectVersionId(value);
    }

    /**
     * 구성 요소로 ObjectVersionId 조립.
     *
     * @param objectId 소속 컨테이너 uid
     * @param creatingSystemId 생성 시스템
     * @param versionTreeId tree 내 위치
     * @return ObjectVersionId 인스턴스
     */
    public static ObjectVersionId of(HierObjectId objectId, Uid creatingSystemId, VersionTreeId versionTreeId) {
        if (objectId == null || creatingSystemId == null || versionTreeId == null) {
            throw new IllegalArgumentException("All parts are required for ObjectVersionId");
        }
        return new ObjectVersionId(
            objectId.value() + SEPARATOR + creatingSystemId.value() + SEPARATOR + versionTreeId.value()
        );
    }

    /**
     * 이 ID가 가리키는 버전의 논리 객체 식별자.
     *
     * @return root UID
     */
    public Uid objectId() {
        return root();
    }

    public Uid creatingSystemId() {
        return creatingSystemId;
    }

    public VersionTreeId versionTreeId() {
        return versionTreeId;
    }

    public boolean isBranch() {
        return versionTreeId.isBranch();
    }
}
