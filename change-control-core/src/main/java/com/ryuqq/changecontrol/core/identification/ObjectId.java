package com.ryuqq.changecontrol.core.identification;

/**
 * 정보 객체 식별자의 상위 타입.
 *
 * <p>구체 타입과 어휘 값이 모두 같을 때 동등합니다.</p>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public abstract class ObjectId {

    private final String value;

    protected ObjectId(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("ObjectId value cannot be null or empty");
        }
        this.value = value;
    }

    /**
     * 식별자 어휘 값 조회.
     *
     * @return 입력된 그대로의 값
     */
    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ObjectId objectId = (ObjectId) o;
        return value.equals(objectId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
