package com.ryuqq.changecontrol.core.terminology;

/**
 * 사람이 읽는 텍스트. terminology 코드와 연결될 수도 있다.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public sealed interface TextValue permits PlainText, CodedText {

    /**
     * 표시용 텍스트.
     *
     * @return 텍스트 (빈 값 불가)
     */
    String value();
}
