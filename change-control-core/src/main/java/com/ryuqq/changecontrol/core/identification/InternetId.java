package com.ryuqq.changecontrol.core.identification;

import com.ryuqq.changecontrol.core.exception.InvalidUidFormatException;

import java.util.regex.Pattern;

/**
 * 역방향 인터넷 도메인 이름 (RFC 1034 label을 역순으로 나열, label 2개 이상).
 *
 * @param value 어휘 값
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record InternetId(String value) implements Uid {

    static final Pattern PATTERN = Pattern.compile("^(?=.{1,253}$)(?!.*--)(?:(?!-)(?![0-9])[a-zA-Z0-9-]{1,63}(?<!-)\\.)+(?:(?!-)[a-zA-Z0-9-]{1,63}(?<!-))$");

    /**
     * Compact Constructor.
     *
     * @throws InvalidUidFormatException 유효한 internet id가 아닌 경우
     */
    public InternetId {
        if (value == null || !PATTERN.matcher(value).matches()) {
            throw new InvalidUidFormatException("Invalid internet id: '" + value + "'");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
