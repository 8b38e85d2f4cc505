package com.ryuqq.changecontrol.core.identification;

import com.ryuqq.changecontrol.core.exception.InvalidUidFormatException;

import java.util.regex.Pattern;

/**
 * ISO/IEC 8824 object identifier. 점으로 구분된 정수열이며 첫 arc는 0, 1, 2 중 하나.
 *
 * <p>leaf가 아닌 arc는 나머지 식별자를 관리하는 할당 기관을 나타냅니다.
 * {@code 0}이 아닌 arc는 선행 0을 가질 수 없습니다.</p>
 *
 * @param value 어휘 값
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record IsoOid(String value) implements Uid {

    static final Pattern PATTERN = Pattern.compile("^[0-2](\\.0|\\.[1-9][0-9]*)*$");

    /**
     * Compact Constructor.
     *
     * @throws InvalidUidFormatException 유효한 ISO OID가 아닌 경우
     */
    public IsoOid {
        if (value == null || !PATTERN.matcher(value).matches()) {
            throw new InvalidUidFormatException("Invalid ISO OID: '" + value + "'");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
