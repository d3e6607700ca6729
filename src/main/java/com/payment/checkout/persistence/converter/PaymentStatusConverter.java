package com.payment.checkout.persistence.converter;

import com.payment.checkout.domain.PaymentStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Maps {@link PaymentStatus} to its stored wire value rather than the constant name.
 */
@Converter(autoApply = true)
public class PaymentStatusConverter implements AttributeConverter<PaymentStatus, String> {

    @Override
    public String convertToDatabaseColumn(PaymentStatus status) {
        return status != null ? status.getValue() : null;
    }

    @Override
    public PaymentStatus convertToEntityAttribute(String value) {
        return value != null ? PaymentStatus.fromValue(value) : null;
    }
}
