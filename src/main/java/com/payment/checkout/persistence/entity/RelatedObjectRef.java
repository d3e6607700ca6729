package com.payment.checkout.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Reference to a record of any registered entity type, stored as a
 * {@code content_type} / {@code object_id} column pair. Both columns are set or
 * both are null; an owner with no reference holds {@code null}.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RelatedObjectRef {

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", length = 32)
    private RelatedObjectType type;

    @PositiveOrZero
    @Column(name = "object_id")
    private Long objectId;

    private RelatedObjectRef(RelatedObjectType type, Long objectId) {
        this.type = type;
        this.objectId = objectId;
    }

    public static RelatedObjectRef of(RelatedObjectType type, Long objectId) {
        if (type == null || objectId == null) {
            throw new IllegalArgumentException("Related reference needs both a type and an object id");
        }
        if (objectId < 0) {
            throw new IllegalArgumentException("Related object id must not be negative: " + objectId);
        }
        return new RelatedObjectRef(type, objectId);
    }

    public static RelatedObjectRef to(ReferenceableEntity entity) {
        if (entity == null || entity.getId() == null) {
            throw new IllegalArgumentException("Related reference target must be a persisted entity");
        }
        return of(RelatedObjectType.forEntity(entity), entity.getId());
    }

    @AssertTrue(message = "content type and object id must both be set or both be null")
    public boolean isComplete() {
        return (type == null) == (objectId == null);
    }

    @Override
    public String toString() {
        return type + "#" + objectId;
    }
}
