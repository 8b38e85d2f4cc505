package com.ryuqq.changecontrol.core.generic;

import com.ryuqq.changecontrol.core.identification.ObjectRef;

import java.util.Objects;
import java.util.Optional;

/**
 * 기록의 주체, 즉 기록 소유자.
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class PartySelf implements PartyProxy {

    private static final PartySelf ANONYMOUS = new PartySelf(null);

    private final ObjectRef externalRef;

    private PartySelf(ObjectRef externalRef) {
        this.externalRef = externalRef;
    }

    /**
     * 외부 링크 없는 기록 주체.
     *
     * @return external ref 없는 PartySelf
     */
    public static PartySelf anonymous() {
        return ANONYMOUS;
    }

    public static PartySelf of(ObjectRef externalRef) {
        if (externalRef == null) {
            throw new IllegalArgumentException("externalRef cannot be null, use anonymous() instead");
        }
        return new PartySelf(externalRef);
    }

    @Override
    public Optional<ObjectRef> externalRef() {
        return Optional.ofNullable(externalRef);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PartySelf partySelf = (PartySelf) o;
        return Objects.equals(externalRef, partySelf.externalRef);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(externalRef);
    }

    @Override
    public String toString() {
        return "PartySelf{externalRef=" + externalRef + "}";
    }
}
