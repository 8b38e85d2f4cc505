package com.ryuqq.changecontrol.core.identification;

/**
 * 로컬에서 정의한 임의 체계의 식별자 (예: demographic 시스템의 party ID).
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class GenericId extends ObjectId {

    private final String scheme;

    private GenericId(String value, String scheme) {
        super(value);
        if (scheme == null || scheme.isBlank()) {
            throw new IllegalArgumentException("scheme cannot be null or blank");
        }
        this.scheme = scheme;
    }

    public static GenericId of(String value, String scheme) {
        return new GenericId(value, scheme);
    }

    public String scheme() {
        return scheme;
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && scheme.equals(((GenericId) o).scheme);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + scheme.hashCode();
    }
}
