package com.payment.checkout.domain;

import java.util.Arrays;

/**
 * Lifecycle states written by the gateway callback flow. Each constant carries
 * the exact value stored in the {@code status} column, which must not change
 * for existing rows.
 */
public enum PaymentStatus {
    /** Checkout started, buyer redirected to the gateway. */
    CHECKOUT("checkout"),
    /** Buyer cancelled on the gateway side. */
    CANCELED("canceled"),
    /** Gateway accepted the payment but has not settled it. */
    PENDING("pending"),
    /** Payment settled. */
    COMPLETED("completed");

    private final String value;

    PaymentStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PaymentStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown payment status: " + value));
    }
}
