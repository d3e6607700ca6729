package com.payment.checkout.persistence.repository;

import com.payment.checkout.persistence.entity.PaymentTransactionEntity;
import com.payment.checkout.persistence.entity.PaymentTransactionErrorEntity;
import com.payment.checkout.persistence.entity.UserAccountEntity;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Append-only repository for gateway error records. Exposes no
 * delete or bulk-update methods.
 */
@org.springframework.stereotype.Repository
public interface PaymentTransactionErrorRepository extends Repository<PaymentTransactionErrorEntity, Long> {

    PaymentTransactionErrorEntity save(PaymentTransactionErrorEntity error);

    Optional<PaymentTransactionErrorEntity> findById(Long id);

    long count();

    long countByTransactionId(Long transactionId);

    @Query("SELECT e FROM PaymentTransactionErrorEntity e ORDER BY e.date DESC, e.id DESC")
    List<PaymentTransactionErrorEntity> findAllNewestFirst();

    @Query("SELECT e FROM PaymentTransactionErrorEntity e WHERE e.user = :user ORDER BY e.date DESC, e.id DESC")
    List<PaymentTransactionErrorEntity> findByUserNewestFirst(@Param("user") UserAccountEntity user);

    @Query("SELECT e FROM PaymentTransactionErrorEntity e WHERE e.transaction = :transaction ORDER BY e.date DESC, e.id DESC")
    List<PaymentTransactionErrorEntity> findByTransactionNewestFirst(@Param("transaction") PaymentTransactionEntity transaction);
}
