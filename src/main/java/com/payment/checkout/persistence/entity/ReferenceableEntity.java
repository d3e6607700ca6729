package com.payment.checkout.persistence.entity;

/**
 * An entity that can be the target of a {@link RelatedObjectRef}.
 */
public interface ReferenceableEntity {

    Long getId();
}
