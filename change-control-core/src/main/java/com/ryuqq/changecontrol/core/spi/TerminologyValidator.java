package com.ryuqq.changecontrol.core.spi;

import com.ryuqq.changecontrol.core.terminology.CodePhrase;
import com.ryuqq.changecontrol.core.terminology.TerminologyGroup;

/**
 * Terminology validator SPI.
 *
 * <p>감사 또는 버전 메타데이터를 생성할 때마다 호출됩니다. 엔진은 코드 해석 방법을 모르며,
 * 코드가 그룹에 속하는지만 묻습니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@code false}는 코드가 그룹의 멤버가 아님을 뜻함</li>
 *   <li>여기서 던진 예외는 생성 중인 객체의 생성 실패로 호출자에게 보고됨</li>
 *   <li>구현체는 부수 효과가 없어야 함</li>
 * </ul>
 *
 * @author Change Control Team
 * @since 1.0.0
 * @see com.ryuqq.changecontrol.core.terminology.OpenEhrSupportTerminology
 */
@FunctionalInterface
public interface TerminologyValidator {

    /**
     * 코드의 그룹 멤버십 검사.
     *
     * @param code 검사할 코드
     * @param group 코드가 속해야 할 그룹
     * @return 그룹의 멤버이면 true
     */
    boolean verifyCodeInGroup(CodePhrase code, TerminologyGroup group);
}
