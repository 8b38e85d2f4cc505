package com.ryuqq.changecontrol.core.terminology;

/**
 * 의미가 terminology 코드로 정해지는 텍스트.
 *
 * <p>{@code value}는 사용자에게 보여 주는 rubric이며, 의미의 동등성은
 * {@code definingCode}만으로 판단합니다.</p>
 *
 * @param value 코드의 rubric
 * @param definingCode 정의 코드
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record CodedText(
    String value,
    CodePhrase definingCode
) implements TextValue {

    public CodedText {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("CodedText value cannot be null or empty");
        }
        if (definingCode == null) {
            throw new IllegalArgumentException("definingCode cannot be null");
        }
    }

    public static CodedText of(String value, CodePhrase definingCode) {
        return new CodedText(value, definingCode);
    }

    /**
     * 정의 코드의 code string 조회.
     *
     * @return code string
     */
    public String code() {
        return definingCode.codeString();
    }
}
