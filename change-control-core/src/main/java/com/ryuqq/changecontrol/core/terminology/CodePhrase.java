package com.ryuqq.changecontrol.core.terminology;

/**
 * terminology의 완전한 코드.
 *
 * @param terminologyId terminology 식별자 (예: {@code openehr})
 * @param codeString terminology 내 코드 (예: {@code 249})
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record CodePhrase(
    String terminologyId,
    String codeString
) {

    public CodePhrase {
        if (terminologyId == null || terminologyId.isBlank()) {
            throw new IllegalArgumentException("terminologyId cannot be null or blank");
        }
        if (codeString == null || codeString.isBlank()) {
            throw new IllegalArgumentException("codeString cannot be null or blank");
        }
    }

    public static CodePhrase of(String terminologyId, String codeString) {
        return new CodePhrase(terminologyId, codeString);
    }

    @Override
    public String toString() {
        return terminologyId + "::" + codeString;
    }
}
