package com.ryuqq.changecontrol.core.identification;

import com.ryuqq.changecontrol.core.exception.InvalidUidFormatException;

import java.util.regex.Pattern;

/**
 * 8-4-4-4-12 16진수 형식의 DCE UUID.
 *
 * @param value 어휘 값
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record DceUuid(String value) implements Uid {

    static final Pattern PATTERN = Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    /**
     * Compact Constructor.
     *
     * @throws InvalidUidFormatException 유효한 UUID가 아닌 경우
     */
    public DceUuid {
        if (value == null || !PATTERN.matcher(value).matches()) {
            throw new InvalidUidFormatException("Invalid UUID: '" + value + "'");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
