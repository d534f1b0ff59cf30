package com.openforge.actionmind.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class OutcomeConverter implements AttributeConverter<Outcome, Integer> {

    @Override
    public Integer convertToDatabaseColumn(Outcome outcome) {
        return outcome == null ? null : outcome.code();
    }

    @Override
    public Outcome convertToEntityAttribute(Integer code) {
        return code == null ? null : Outcome.fromCode(code);
    }
}
