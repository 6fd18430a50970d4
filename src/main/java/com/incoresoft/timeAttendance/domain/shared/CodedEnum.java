package com.incoresoft.timeAttendance.domain.shared;

/**
 * Closed enumeration persisted as a short lowercase code.
 */
public interface CodedEnum {
    String getCode();

    /**
     * Resolves a stored code, rejecting anything that is not a known variant.
     */
    static <E extends Enum<E> & CodedEnum> E fromCode(Class<E> type, String code) {
        if (code == null) {
            throw new IllegalArgumentException("Missing " + type.getSimpleName() + " code");
        }
        String normalized = code.trim();
        for (E value : type.getEnumConstants()) {
            if (value.getCode().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " code: '" + code + "'");
    }
}
