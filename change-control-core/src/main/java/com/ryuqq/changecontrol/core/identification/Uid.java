package com.ryuqq.changecontrol.core.identification;

import com.ryuqq.changecontrol.core.exception.InvalidUidFormatException;

/**
 * 전역 고유 root 식별자.
 *
 * <p>UID는 오직 하나의 정보 개체만 가리키며 재사용되지 않습니다. 세 가지 어휘 형식을
 * 인식합니다:</p>
 * <ul>
 *   <li>{@link IsoOid} - ISO/IEC 8824 object identifier (예: {@code 1.2.840.113619})</li>
 *   <li>{@link DceUuid} - 8-4-4-4-12 16진수 UUID</li>
 *   <li>{@link InternetId} - 역방향 인터넷 도메인 (예: {@code net.example.ehr})</li>
 * </ul>
 *
 * <p>타입과 문자열이 정확히 같을 때 동등합니다. 대소문자 변환이나 trim 같은 정규화는
 * 하지 않습니다.</p>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public sealed interface Uid permits IsoOid, DceUuid, InternetId {

    /**
     * UID 어휘 값 조회.
     *
     * @return 파싱한 그대로의 값
     */
    String value();

    /**
     * 형식을 모르는 값을 UID로 파싱.
     *
     * <p>OID, UUID, internet id 순서로 시도합니다.</p>
     *
     * @param value 후보 값
     * @return 파싱된 UID
     * @throws InvalidUidFormatException 어느 형식에도 맞지 않는 경우
     */
    static Uid parse(String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidUidFormatException("UID cannot be null or empty");
        }
        if (IsoOid.PATTERN.matcher(value).matches()) {
            return new IsoOid(value);
        }
        if (DceUuid.PATTERN.matcher(value).matches()) {
            return new DceUuid(value);
        }
        if (InternetId.PATTERN.matcher(value).matches()) {
            return new InternetId(value);
        }
        throw new InvalidUidFormatException("Value is neither an OID, a UUID nor an internet id: '" + value + "'");
    }

    /**
     * 값이 UID 형식 중 하나에 맞는지 검사.
     *
     * @param value 후보 값 (null 허용)
     * @return {@link #parse(String)}가 성공할 값이면 true
     */
    static boolean isValid(String value) {
        return value != null
            && (IsoOid.PATTERN.matcher(value).matches()
                || DceUuid.PATTERN.matcher(value).matches()
                || InternetId.PATTERN.matcher(value).matches());
    }
}
