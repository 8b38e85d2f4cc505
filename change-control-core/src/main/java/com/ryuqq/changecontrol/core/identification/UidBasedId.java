package com.ryuqq.changecontrol.core.identification;

import com.ryuqq.changecontrol.core.exception.InvalidUidFormatException;

/**
 * 어휘 형식이 {@code root['::'extension]}인 UID 기반 식별자.
 *
 * <p>값은 첫 {@code ::}에서 나뉩니다. root는 유효한 {@link Uid}여야 하고, extension의
 * 구조는 하위 클래스가 정합니다.</p>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public abstract class UidBasedId extends ObjectId {

    static final String SEPARATOR = "::";

    private final Uid root;
    private final String extension;

    /**
     * @param value 전체 어휘 값
     * @throws InvalidUidFormatException root 부분이 유효한 UID가 아닌 경우
     */
    protected UidBasedId(String value) {
        super(requireValue(value));
        int separator = value.indexOf(SEPARATOR);
        String rootPart = separator < 0 ? value : value.substring(0, separator);
        try {
            this.root = Uid.parse(rootPart);
        } catch (InvalidUidFormatException e) {
            throw new InvalidUidFormatException("Root of '" + value + "' is not a valid UID", e);
        }
        this.extension = separator < 0 ? "" : value.substring(separator + SEPARATOR.length());
    }

    private static String requireValue(String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidUidFormatException("UID based id cannot be null or empty");
        }
        return value;
    }

    /**
     * 객체가 존재하는 개념적 namespace의 식별자.
     *
     * @return 첫 {@code ::} 왼쪽 부분, 없으면 전체 값
     */
    public Uid root() {
        return root;
    }

    /**
     * root namespace 안에서의 로컬 식별자.
     *
     * @return 첫 {@code ::} 오른쪽 부분, 없으면 빈 문자열
     */
    public String extension() {
        return extension;
    }

    public boolean hasExtension() {
        return !extension.isEmpty();
    }
}
