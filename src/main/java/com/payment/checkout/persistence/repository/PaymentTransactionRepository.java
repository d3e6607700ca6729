package com.payment.checkout.persistence.repository;

import com.payment.checkout.domain.PaymentStatus;
import com.payment.checkout.persistence.entity.PaymentTransactionEntity;
import com.payment.checkout.persistence.entity.UserAccountEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for payment transactions. Listing queries use the default
 * ordering: newest creation date first, then gateway transaction id.
 */
@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransactionEntity, Long> {

    @Query("SELECT t FROM PaymentTransactionEntity t ORDER BY t.creationDate DESC, t.transactionId ASC")
    List<PaymentTransactionEntity> findAllOrdered();

    @Query("SELECT t FROM PaymentTransactionEntity t WHERE t.user = :user ORDER BY t.creationDate DESC, t.transactionId ASC")
    List<PaymentTransactionEntity> findByUserOrdered(@Param("user") UserAccountEntity user);

    Optional<PaymentTransactionEntity> findFirstByTransactionIdOrderByCreationDateDesc(String transactionId);

    Page<PaymentTransactionEntity> findByStatus(PaymentStatus status, Pageable pageable);

    @Query("SELECT t FROM PaymentTransactionEntity t WHERE t.creationDate BETWEEN :startDate AND :endDate "
            + "ORDER BY t.creationDate DESC, t.transactionId ASC")
    List<PaymentTransactionEntity> findByDateRange(@Param("startDate") Instant startDate, @Param("endDate") Instant endDate);
}
