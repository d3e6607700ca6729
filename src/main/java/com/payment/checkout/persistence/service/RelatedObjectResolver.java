package com.payment.checkout.persistence.service;

import com.payment.checkout.persistence.entity.ReferenceableEntity;
import com.payment.checkout.persistence.entity.RelatedObjectRef;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Loads the record a {@link RelatedObjectRef} points at. A reference whose
 * target has been deleted resolves to empty.
 */
@Slf4j
@Component
public class RelatedObjectResolver {

    @PersistenceContext
    private EntityManager entityManager;

    @Transactional(readOnly = true)
    public Optional<ReferenceableEntity> resolve(RelatedObjectRef ref) {
        if (ref == null) {
            return Optional.empty();
        }
        ReferenceableEntity target = entityManager.find(ref.getType().getEntityClass(), ref.getObjectId());
        if (target == null) {
            log.debug("Related object not found: {}", ref);
        }
        return Optional.ofNullable(target);
    }

    /**
     * Resolves the reference only if it points at the given type.
     */
    @Transactional(readOnly = true)
    public <T extends ReferenceableEntity> Optional<T> resolve(RelatedObjectRef ref, Class<T> expectedType) {
        if (ref == null || !expectedType.isAssignableFrom(ref.getType().getEntityClass())) {
            return Optional.empty();
        }
        return resolve(ref).map(expectedType::cast);
    }
}
