package com.incoresoft.timeAttendance.domain.shared;

import jakarta.persistence.AttributeConverter;

/**
 * Maps a {@link CodedEnum} to its code column. Loading a row with an unknown code fails
 * instead of leaking the raw string into the domain.
 */
public abstract class CodedEnumConverter<E extends Enum<E> & CodedEnum> implements AttributeConverter<E, String> {
    private final Class<E> type;

    protected CodedEnumConverter(Class<E> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        return dbData == null ? null : CodedEnum.fromCode(type, dbData);
    }
}
