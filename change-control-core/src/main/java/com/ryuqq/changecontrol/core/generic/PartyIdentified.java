package com.ryuqq.changecontrol.core.generic;

import com.ryuqq.changecontrol.core.identification.ObjectRef;

import java.util.Objects;
import java.util.Optional;

/**
 * 기록 주체가 아닌 식별된 party. 주로 데이터를 커밋하거나 증명하는 의료진 또는 기관.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>externalRef와 name 중 하나 이상 존재</li>
 *   <li>name이 있으면 빈 값 불가</li>
 * </ul>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class PartyIdentified implements PartyProxy {

    private final ObjectRef externalRef;
    private final String name;

    private PartyIdentified(ObjectRef externalRef, String name) {
        if (externalRef == null && name == null) {
            throw new IllegalArgumentException("Either an externalRef or a name must be provided");
        }
        if (name != null && name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty when provided");
        }
        this.externalRef = externalRef;
        this.name = name;
    }

    public static PartyIdentified named(String name) {
        return new PartyIdentified(null, name);
    }

    public static PartyIdentified of(ObjectRef externalRef, String name) {
        return new PartyIdentified(externalRef, name);
    }

    @Override
    public Optional<ObjectRef> externalRef() {
        return Optional.ofNullable(externalRef);
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PartyIdentified that = (PartyIdentified) o;
        return Objects.equals(externalRef, that.externalRef) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(externalRef, name);
    }

    @Override
    public String toString() {
        return "PartyIdentified{externalRef=" + externalRef + ", name='" + name + "'}";
    }
}
