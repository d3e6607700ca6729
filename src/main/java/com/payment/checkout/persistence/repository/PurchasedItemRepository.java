package com.payment.checkout.persistence.repository;

import com.payment.checkout.persistence.entity.ItemEntity;
import com.payment.checkout.persistence.entity.PaymentTransactionEntity;
import com.payment.checkout.persistence.entity.PurchasedItemEntity;
import com.payment.checkout.persistence.entity.UserAccountEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for purchased-item lines. Listing queries order by the parent
 * transaction: last saved first, then gateway transaction id.
 */
@Repository
public interface PurchasedItemRepository extends JpaRepository<PurchasedItemEntity, Long> {

    @Query("SELECT p FROM PurchasedItemEntity p JOIN p.transaction t ORDER BY t.date DESC, t.transactionId ASC")
    List<PurchasedItemEntity> findAllOrdered();

    @Query("SELECT p FROM PurchasedItemEntity p JOIN p.transaction t WHERE p.user = :user "
            + "ORDER BY t.date DESC, t.transactionId ASC")
    List<PurchasedItemEntity> findByUserOrdered(@Param("user") UserAccountEntity user);

    List<PurchasedItemEntity> findByTransactionOrderByIdAsc(PaymentTransactionEntity transaction);

    long countByTransactionId(Long transactionId);

    boolean existsByItemId(Long itemId);

    boolean existsByUserAndItem(UserAccountEntity user, ItemEntity item);

    @Query("SELECT p.identifier AS identifier, SUM(p.price * p.quantity) AS total FROM PurchasedItemEntity p "
            + "WHERE p.transaction = :transaction GROUP BY p.identifier ORDER BY p.identifier")
    List<IdentifierTotal> sumTotalsByIdentifier(@Param("transaction") PaymentTransactionEntity transaction);

    /** Projection for {@link #sumTotalsByIdentifier}. */
    interface IdentifierTotal {

        String getIdentifier();

        Double getTotal();
    }
}
