package com.ryuqq.changecontrol.core.terminology;

import com.ryuqq.changecontrol.core.exception.ChangeControlException;
import com.ryuqq.changecontrol.core.spi.TerminologyValidator;

import java.util.function.BiFunction;

/**
 * {@link TerminologyValidator}를 실행하고, 부정 응답이나 validator 자체의 실패를 검사 중인
 * 그룹의 예외로 바꾼다.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class CodeGroupCheck {

    private CodeGroupCheck() {
    }

    /**
     * {@code code}가 {@code group}의 멤버인지 검증.
     *
     * @param validator terminology validator
     * @param code 검사할 코드
     * @param group 기대 그룹
     * @param failure 메시지와 선택적 cause로 예외를 만드는 함수
     * @param <E> 그룹의 예외 타입
     * @throws E 코드가 그룹에 없거나 validator가 실패한 경우
     */
    public static <E extends ChangeControlException> void requireCodeInGroup(
        TerminologyValidator validator,
        CodePhrase code,
        TerminologyGroup group,
        BiFunction<String, Throwable, E> failure
    ) {
        if (validator == null) {
            throw new IllegalArgumentException("TerminologyValidator cannot be null");
        }
        boolean member;
        try {
            member = validator.verifyCodeInGroup(code, group);
        } catch (RuntimeException e) {
            throw failure.apply("Terminology validator failed for code " + code + " in group '" + group.groupId() + "'", e);
        }
        if (!member) {
            throw failure.apply("Code " + code + " is not in terminology group '" + group.groupId() + "'", null);
        }
    }
}
