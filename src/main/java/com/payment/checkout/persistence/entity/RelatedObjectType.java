package com.payment.checkout.persistence.entity;

import java.util.Arrays;

/**
 * Registered entity types a {@link RelatedObjectRef} may point at. Stored by name
 * in the {@code content_type} column.
 */
public enum RelatedObjectType {
    ITEM(ItemEntity.class),
    PAYMENT_TRANSACTION(PaymentTransactionEntity.class),
    PURCHASED_ITEM(PurchasedItemEntity.class),
    USER_ACCOUNT(UserAccountEntity.class);

    private final Class<? extends ReferenceableEntity> entityClass;

    RelatedObjectType(Class<? extends ReferenceableEntity> entityClass) {
        this.entityClass = entityClass;
    }

    public Class<? extends ReferenceableEntity> getEntityClass() {
        return entityClass;
    }

    /**
     * Finds the type registered for the given entity. Uses {@code isInstance} so
     * that ORM proxies resolve to their entity type.
     */
    public static RelatedObjectType forEntity(ReferenceableEntity entity) {
        return Arrays.stream(values())
                .filter(type -> type.entityClass.isInstance(entity))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Entity type is not registered for related references: " + entity.getClass().getName()));
    }
}
