package com.payment.checkout.persistence.service;

import com.payment.checkout.domain.PaymentStatus;
import com.payment.checkout.persistence.entity.PaymentTransactionEntity;
import com.payment.checkout.persistence.entity.RelatedObjectRef;
import com.payment.checkout.persistence.entity.UserAccountEntity;
import com.payment.checkout.persistence.repository.PaymentTransactionErrorRepository;
import com.payment.checkout.persistence.repository.PaymentTransactionRepository;
import com.payment.checkout.persistence.repository.PurchasedItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service for persisting payment transactions. Transaction ids and statuses
 * come from the gateway callback flow; this service only stores them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentTransactionService {

    private final PaymentTransactionRepository transactionRepository;
    private final PurchasedItemRepository purchasedItemRepository;
    private final PaymentTransactionErrorRepository errorRepository;

    /**
     * Persists a new transaction created now. {@code related} may be null.
     */
    @Transactional
    public PaymentTransactionEntity createTransaction(UserAccountEntity user, String transactionId, BigDecimal value,
                                                      PaymentStatus status, RelatedObjectRef related) {
        return createTransaction(user, transactionId, value, status, related, null);
    }

    /**
     * Persists a new transaction with the given creation date, e.g. when
     * importing past gateway transactions. A null {@code creationDate} means now.
     */
    @Transactional
    public PaymentTransactionEntity createTransaction(UserAccountEntity user, String transactionId, BigDecimal value,
                                                      PaymentStatus status, RelatedObjectRef related,
                                                      Instant creationDate) {
        if (user == null) {
            throw new IllegalArgumentException("Transaction user is required");
        }
        if (transactionId == null || transactionId.isBlank()) {
            throw new IllegalArgumentException("Gateway transaction id is required");
        }
        if (value == null || status == null) {
            throw new IllegalArgumentException("Transaction value and status are required");
        }
        PaymentTransactionEntity entity = PaymentTransactionEntity.builder()
                .user(user)
                .related(related)
                .transactionId(transactionId)
                .value(value)
                .status(status)
                .creationDate(creationDate)
                .build();
        PaymentTransactionEntity saved = transactionRepository.save(entity);
        log.debug("Persisted payment transaction: id={}, transactionId={}, status={}",
                saved.getId(), transactionId, status);
        return saved;
    }

    /**
     * Records a status reported by the gateway. Refreshes {@code date}; the
     * creation date stays as it was.
     */
    @Transactional
    public PaymentTransactionEntity updateStatus(Long id, PaymentStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("Transaction status is required");
        }
        PaymentTransactionEntity entity = getTransaction(id);
        PaymentStatus previous = entity.getStatus();
        entity.setStatus(status);
        PaymentTransactionEntity saved = transactionRepository.save(entity);
        log.info("Payment transaction status changed: id={}, transactionId={}, {} -> {}",
                id, entity.getTransactionId(), previous, status);
        return saved;
    }

    @Transactional
    public PaymentTransactionEntity updateValue(Long id, BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("Transaction value is required");
        }
        PaymentTransactionEntity entity = getTransaction(id);
        entity.setValue(value);
        log.debug("Payment transaction value changed: id={}, value={}", id, value);
        return transactionRepository.save(entity);
    }

    @Transactional(readOnly = true)
    public PaymentTransactionEntity getTransaction(Long id) {
        return transactionRepository.findById(id)
                .orElseThrow(() -> RecordNotFoundException.of("PaymentTransaction", id));
    }

    /**
     * Looks up the most recent transaction carrying the given gateway id.
     */
    @Transactional(readOnly = true)
    public Optional<PaymentTransactionEntity> findByGatewayTransactionId(String transactionId) {
        return transactionRepository.findFirstByTransactionIdOrderByCreationDateDesc(transactionId);
    }

    @Transactional(readOnly = true)
    public List<PaymentTransactionEntity> listTransactions() {
        return transactionRepository.findAllOrdered();
    }

    @Transactional(readOnly = true)
    public List<PaymentTransactionEntity> listTransactions(UserAccountEntity user) {
        return transactionRepository.findByUserOrdered(user);
    }

    @Transactional(readOnly = true)
    public Page<PaymentTransactionEntity> listTransactions(PaymentStatus status, Pageable pageable) {
        return transactionRepository.findByStatus(status, pageable);
    }

    /**
     * Transactions created within {@code [from, to]}, in default order.
     */
    @Transactional(readOnly = true)
    public List<PaymentTransactionEntity> listTransactions(Instant from, Instant to) {
        return transactionRepository.findByDateRange(from, to);
    }

    /**
     * Deletes a transaction that has no purchased items and no error records.
     *
     * @throws RecordInUseException if any row still references the transaction
     */
    @Transactional
    public void deleteTransaction(Long id) {
        PaymentTransactionEntity entity = getTransaction(id);
        long purchases = purchasedItemRepository.countByTransactionId(id);
        long errors = errorRepository.countByTransactionId(id);
        if (purchases > 0 || errors > 0) {
            log.warn("Refusing to delete payment transaction: id={}, purchasedItems={}, errors={}",
                    id, purchases, errors);
            throw new RecordInUseException("PaymentTransaction " + id + " is referenced by "
                    + purchases + " purchased item(s) and " + errors + " error record(s)");
        }
        transactionRepository.delete(entity);
        log.info("Deleted payment transaction: id={}, transactionId={}", id, entity.getTransactionId());
    }
}
