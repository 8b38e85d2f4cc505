package com.ryuqq.changecontrol.core.identification;

import com.ryuqq.changecontrol.core.exception.InvalidVersionTreeIdException;

import java.math.BigInteger;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * version tree 안에서 한 버전의 위치.
 *
 * <p>어휘 형식: {@code trunk_version['.'branch_number'.'branch_version]}. 각 부분은 선행 0이
 * 없는 양의 10진 정수입니다. {@code 1}, {@code 2}, {@code 3}은 trunk 버전이고,
 * {@code 2.1.4}는 trunk 버전 2에서 갈라진 첫 번째 branch의 4번째 버전입니다.</p>
 *
 * <p>각 부분은 숫자 문자열 그대로 보관하므로 문법에 맞는 ID는 모두 파싱되고 원문 그대로
 * 출력됩니다. 숫자 조회 메서드는 {@code long}을 반환합니다.</p>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class VersionTreeId {

    private static final Pattern PATTERN = Pattern.compile("^([1-9]\\d*)(?:\\.([1-9]\\d*)\\.([1-9]\\d*))?$");

    private final String value;
    private final String trunkPart;
    private final String branchNumberPart;
    private final String branchVersionPart;

    private VersionTreeId(String value) {
        if (value == null) {
            throw new InvalidVersionTreeIdException("VersionTreeId cannot be null");
        }
        Matcher matcher = PATTERN.matcher(value);
        if (!matcher.matches()) {
            throw new InvalidVersionTreeIdException(
                "VersionTreeId must be of the form trunk[.branchNumber.branchVersion]: '" + value + "'"
            );
        }
        this.value = value;
        this.trunkPart = matcher.group(1);
        this.branchNumberPart = matcher.group(2);
        this.branchVersionPart = matcher.group(3);
    }

    /**
     * VersionTreeId 파싱.
     *
     * @param value 어휘 값
     * @return VersionTreeId 인스턴스
     * @throws InvalidVersionTreeIdException 문법에 맞지 않는 경우
     */
    public static VersionTreeId of(String value) {
        return new VersionTreeId(value);
    }

    /**
     * trunk 버전 ID 생성.
     *
     * @param trunkVersion trunk 번호 (1부터 시작)
     * @return branch 부분이 없는 VersionTreeId
     * @throws InvalidVersionTreeIdException trunkVersion이 양수가 아닌 경우
     */
    public static VersionTreeId trunk(long trunkVersion) {
        return new VersionTreeId(Long.toString(trunkVersion));
    }

    public String value() {
        return value;
    }

    /**
     * trunk 버전 번호 (1부터 시작).
     *
     * @return trunk 버전
     * @throws ArithmeticException trunk 부분이 {@code long} 범위를 넘는 경우
     */
    public long trunkVersion() {
        return toLong(trunkPart);
    }

    /**
     * branch number와 branch version 부분이 있으면 true.
     *
     * @return branch 여부
     */
    public boolean isBranch() {
        return branchNumberPart != null;
    }

    public OptionalLong branchNumber() {
        return isBranch() ? OptionalLong.of(toLong(branchNumberPart)) : OptionalLong.empty();
    }

    public OptionalLong branchVersion() {
        return isBranch() ? OptionalLong.of(toLong(branchVersionPart)) : OptionalLong.empty();
    }

    /**
     * branch 부분을 무시하고 현재 trunk 다음의 trunk 버전.
     *
     * @return trunk ID {@code trunkVersion + 1}
     */
    public VersionTreeId nextTrunk() {
        return new VersionTreeId(new BigInteger(trunkPart).add(BigInteger.ONE).toString());
    }

    private static long toLong(String part) {
        return new BigInteger(part).longValueExact();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionTreeId that = (VersionTreeId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
