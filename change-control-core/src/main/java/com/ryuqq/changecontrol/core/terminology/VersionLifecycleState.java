package com.ryuqq.changecontrol.core.terminology;

import java.util.Optional;

/**
 * 버전을 커밋할 수 있는 lifecycle 상태.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public enum VersionLifecycleState {

    COMPLETE("532", "complete"),
    INCOMPLETE("553", "incomplete"),
    DELETED("523", "deleted"),
    INACTIVE("800", "inactive"),
    ABANDONED("801", "abandoned");

    private final String code;
    private final String rubric;

    VersionLifecycleState(String code, String rubric) {
        this.code = code;
        this.rubric = rubric;
    }

    public String code() {
        return code;
    }

    public String rubric() {
        return rubric;
    }

    public CodePhrase codePhrase() {
        return CodePhrase.of(OpenEhrSupportTerminology.TERMINOLOGY_ID, code);
    }

    /**
     * 이 값을 담은 CodedText. 감사 또는 버전 메타데이터에 바로 사용할 수 있다.
     *
     * @return rubric을 value로 갖는 CodedText
     */
    public CodedText codedText() {
        return CodedText.of(rubric, codePhrase());
    }

    public static Optional<VersionLifecycleState> fromCode(String code) {
        for (VersionLifecycleState value : values()) {
            if (value.code.equals(code)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * CodedText가 가리키는 값을 찾는다.
     *
     * @param text openEHR terminology의 CodedText
     * @return 일치하는 값, 다른 terminology이거나 알 수 없는 코드면 empty
     */
    public static Optional<VersionLifecycleState> fromCodedText(CodedText text) {
        if (text == null || !OpenEhrSupportTerminology.TERMINOLOGY_ID.equals(text.definingCode().terminologyId())) {
            return Optional.empty();
        }
        return fromCode(text.code());
    }
}
