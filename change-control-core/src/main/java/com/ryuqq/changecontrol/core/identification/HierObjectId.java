package com.ryuqq.changecontrol.core.identification;

import com.ryuqq.changecontrol.core.exception.InvalidUidFormatException;

/**
 * 버전 컨테이너 또는 Contribution의 식별자.
 *
 * <p>HierObjectId는 extension 없는 순수 UID이므로 값이 {@link #root()}와 같습니다.
 * 컨테이너 사본을 가진 모든 시스템에서 같은 ID로 컨테이너를 가리킵니다.</p>
 *
 * <p><strong>유효:</strong> {@code 154b1047-23aa-4d4d-8713-df848fd4d60a},
 * {@code 1.2.840.113619}, {@code net.example.ehr}</p>
 * <p><strong>무효:</strong> {@code 154b1047-23aa-4d4d-8713-df848fd4d60a::sys::1}</p>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class HierObjectId extends UidBasedId {

    private HierObjectId(String value) {
        super(value);
        if (hasExtension() || value.contains(SEPARATOR)) {
            throw new InvalidUidFormatException("HierObjectId cannot carry an extension: '" + value + "'");
        }
    }

    /**
     * HierObjectId 파싱.
     *
     * @param value extension 없는 UID
     * @return HierObjectId 인스턴스
     * @throws InvalidUidFormatException UID가 아니거나 {@code ::}를 포함하는 경우
     */
    public static HierObjectId of(String value) {
        return new HierObjectId(value);
    }

    /**
     * 이미 파싱된 UID를 감싼다.
     *
     * @param uid root 식별자
     * @return 같은 값의 HierObjectId
     */
    public static HierObjectId of(Uid uid) {
        if (uid == null) {
            throw new IllegalArgumentException("uid cannot be null");
        }
        return new HierObjectId(uid.value());
    }
}
