package com.payment.checkout.persistence.repository;

import com.payment.checkout.persistence.entity.ItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the item catalog.
 */
@Repository
public interface ItemRepository extends JpaRepository<ItemEntity, Long> {

    List<ItemEntity> findByIdentifier(String identifier);

    List<ItemEntity> findAllByOrderByNameAsc();
}
