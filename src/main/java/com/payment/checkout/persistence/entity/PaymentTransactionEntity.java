package com.payment.checkout.persistence.entity;

import com.payment.checkout.domain.PaymentStatus;
import jakarta.persistence.*;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persistent entity for one gateway transaction.
 * Kept for the payment flow itself and for later reference.
 * <p>
 * {@code creationDate} is filled on insert when absent and is never written again;
 * {@code date} tracks the last save.
 */
@Entity
@Table(name = "payment_transactions", indexes = {
    @Index(name = "idx_payment_user_id", columnList = "user_id"),
    @Index(name = "idx_payment_transaction_id", columnList = "transaction_id"),
    @Index(name = "idx_payment_creation_date", columnList = "creation_date"),
    @Index(name = "idx_payment_status", columnList = "status")
})
@Check(constraints = "(content_type IS NULL) = (object_id IS NULL)")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransactionEntity implements ReferenceableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_payment_transaction_user"))
    private UserAccountEntity user;

    @Valid
    @Embedded
    private RelatedObjectRef related;

    @Column(name = "creation_date", updatable = false)
    private Instant creationDate;

    @Column(name = "date", nullable = false)
    private Instant date;

    @NotBlank
    @Size(max = 32)
    @Column(name = "transaction_id", nullable = false, length = 32)
    private String transactionId;

    @NotNull
    @Digits(integer = 6, fraction = 2)
    @Column(name = "value", nullable = false, precision = 8, scale = 2)
    private BigDecimal value;

    @NotNull
    @Column(name = "status", nullable = false, length = 16)
    private PaymentStatus status;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (creationDate == null) {
            creationDate = now;
        }
        date = now;
    }

    @PreUpdate
    protected void onUpdate() {
        date = Instant.now();
    }

    @Override
    public String toString() {
        return transactionId;
    }
}
