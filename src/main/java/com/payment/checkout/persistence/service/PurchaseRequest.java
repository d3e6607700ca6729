package com.payment.checkout.persistence.service;

import com.payment.checkout.persistence.entity.ItemEntity;
import com.payment.checkout.persistence.entity.PaymentTransactionEntity;
import com.payment.checkout.persistence.entity.RelatedObjectRef;
import com.payment.checkout.persistence.entity.UserAccountEntity;
import lombok.Builder;
import lombok.Value;

/**
 * One line to record against a transaction. Either {@code item} or
 * {@code related} identifies what was bought; both may be absent for free-text
 * lines grouped only by {@code identifier}.
 */
@Value
@Builder
public class PurchaseRequest {

    UserAccountEntity user;
    PaymentTransactionEntity transaction;
    ItemEntity item;
    RelatedObjectRef related;
    String identifier;
    /** Price per unit; defaults to the item's current value when an item is given. */
    Double price;
    Integer quantity;
}
