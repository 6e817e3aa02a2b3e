package com.retailpos.pricing.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores benefit types in their lowercase form ({@code percent}, {@code amount},
 * {@code absolute_rate}).
 */
@Converter(autoApply = true)
public class BenefitTypeConverter implements AttributeConverter<BenefitType, String> {

    @Override
    public String convertToDatabaseColumn(BenefitType type) {
        if (type == null) {
            return BenefitType.PERCENT.getValue();
        }
        return type.getValue();
    }

    @Override
    public BenefitType convertToEntityAttribute(String dbData) {
        return BenefitType.fromValue(dbData);
    }
}
