package com.payment.checkout.persistence.entity;

import jakarta.persistence.*;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Check;

/**
 * Which user purchased which item, in what quantity and at what price.
 * <p>
 * The line either points at a catalog {@link ItemEntity} or, through
 * {@code related}, at any other registered record. {@code price} is the price at
 * purchase time and does not follow later changes to the item.
 */
@Entity
@Table(name = "purchased_items", indexes = {
    @Index(name = "idx_purchase_user_id", columnList = "user_id"),
    @Index(name = "idx_purchase_transaction_id", columnList = "transaction_id"),
    @Index(name = "idx_purchase_item_id", columnList = "item_id"),
    @Index(name = "idx_purchase_identifier", columnList = "identifier")
})
@Check(constraints = "quantity > 0 AND ((content_type IS NULL) = (object_id IS NULL))")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PurchasedItemEntity implements ReferenceableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_purchased_item_user"))
    private UserAccountEntity user;

    /** Groups lines of the same kind, e.g. shipping vs. goods. */
    @Size(max = 256)
    @Column(name = "identifier", length = 256)
    private String identifier;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "transaction_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_purchased_item_transaction"))
    private PaymentTransactionEntity transaction;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "item_id",
            foreignKey = @ForeignKey(name = "fk_purchased_item_item"))
    private ItemEntity item;

    @Valid
    @Embedded
    private RelatedObjectRef related;

    @Column(name = "price")
    private Double price;

    @NotNull
    @Positive
    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Override
    public String toString() {
        return String.format("%d %s of %s [%s]",
                quantity, item, user != null ? user.getEmail() : null, transaction);
    }
}
