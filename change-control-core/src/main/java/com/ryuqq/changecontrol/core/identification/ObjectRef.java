package com.ryuqq.changecontrol.core.identification;

/**
 * 특정 namespace에 있는 객체에 대한 참조.
 *
 * <p>버전의 Contribution, 컨테이너 소유자, party 참조에 사용됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ObjectRef contribution = ObjectRef.of("local", "CONTRIBUTION", contributionUid);
 * </pre>
 *
 * @param namespace ID가 속한 namespace (예: {@code local} 또는 system id)
 * @param type 참조 대상 타입 이름 (예: {@code CONTRIBUTION})
 * @param id 참조 대상 식별자
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record ObjectRef(
    String namespace,
    String type,
    ObjectId id
) {

    public static final String LOCAL_NAMESPACE = "local";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 비어 있는 경우
     */
    public ObjectRef {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }

    public static ObjectRef of(String namespace, String type, ObjectId id) {
        return new ObjectRef(namespace, type, id);
    }

    /**
     * local namespace의 Contribution 참조 생성.
     *
     * @param contributionUid Contribution uid
     * @return Contribution 참조
     */
    public static ObjectRef contribution(HierObjectId contributionUid) {
        return new ObjectRef(LOCAL_NAMESPACE, "CONTRIBUTION", contributionUid);
    }
}
