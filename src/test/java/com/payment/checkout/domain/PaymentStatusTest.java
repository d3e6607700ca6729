package com.payment.checkout.domain;

import com.payment.checkout.persistence.converter.PaymentStatusConverter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaymentStatusTest {

    private final PaymentStatusConverter converter = new PaymentStatusConverter();

    @Test
    void storedValuesMatchGatewayStatusStrings() {
        assertThat(PaymentStatus.CHECKOUT.getValue()).isEqualTo("checkout");
        assertThat(PaymentStatus.CANCELED.getValue()).isEqualTo("canceled");
        assertThat(PaymentStatus.PENDING.getValue()).isEqualTo("pending");
        assertThat(PaymentStatus.COMPLETED.getValue()).isEqualTo("completed");
    }

    @Test
    void fromValueRejectsUnknownStatus() {
        assertThatThrownBy(() -> PaymentStatus.fromValue("COMPLETED"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("COMPLETED");
    }

    @Test
    void converterWritesWireValueAndReadsItBack() {
        assertThat(converter.convertToDatabaseColumn(PaymentStatus.PENDING)).isEqualTo("pending");
        assertThat(converter.convertToEntityAttribute("canceled")).isEqualTo(PaymentStatus.CANCELED);
    }

    @Test
    void converterPassesNullThrough() {
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
        assertThat(converter.convertToEntityAttribute(null)).isNull();
    }
}
