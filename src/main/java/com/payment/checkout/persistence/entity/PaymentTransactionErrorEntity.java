package com.payment.checkout.persistence.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Audit record of a gateway API call that answered with an error.
 * Written once and never updated: the entity is immutable to Hibernate, every
 * column is insert-only and no setters are exposed.
 */
@Entity
@Immutable
@Table(name = "payment_transaction_errors", indexes = {
    @Index(name = "idx_error_user_id", columnList = "user_id"),
    @Index(name = "idx_error_transaction_id", columnList = "transaction_id"),
    @Index(name = "idx_error_date", columnList = "date")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentTransactionErrorEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "date", nullable = false, updatable = false)
    private Instant date;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_payment_error_user"))
    private UserAccountEntity user;

    @Size(max = 4000)
    @Column(name = "paypal_api_url", length = 4000, updatable = false)
    private String paypalApiUrl;

    /** Payload sent to the endpoint. */
    @Column(name = "request_data", columnDefinition = "TEXT", updatable = false)
    private String requestData;

    /** Full response string returned by the gateway. */
    @Column(name = "response", columnDefinition = "TEXT", updatable = false)
    private String response;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "transaction_id", updatable = false,
            foreignKey = @ForeignKey(name = "fk_payment_error_transaction"))
    private PaymentTransactionEntity transaction;

    @Builder
    private PaymentTransactionErrorEntity(UserAccountEntity user, String paypalApiUrl, String requestData,
                                          String response, PaymentTransactionEntity transaction) {
        this.user = user;
        this.paypalApiUrl = paypalApiUrl != null ? paypalApiUrl : "";
        this.requestData = requestData != null ? requestData : "";
        this.response = response != null ? response : "";
        this.transaction = transaction;
    }

    @PrePersist
    protected void onCreate() {
        date = Instant.now();
    }
}
