package com.ryuqq.changecontrol.core.terminology;

/**
 * 정의 코드가 없는 자유 텍스트.
 *
 * @param value 텍스트
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record PlainText(String value) implements TextValue {

    public PlainText {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("PlainText value cannot be null or empty");
        }
    }

    public static PlainText of(String value) {
        return new PlainText(value);
    }
}
