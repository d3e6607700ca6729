package com.payment.checkout.persistence.service;

import com.payment.checkout.persistence.entity.PaymentTransactionEntity;
import com.payment.checkout.persistence.entity.PaymentTransactionErrorEntity;
import com.payment.checkout.persistence.entity.UserAccountEntity;
import com.payment.checkout.persistence.repository.PaymentTransactionErrorRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Service for the gateway error log. Records are written once and only read afterwards.
 * <p>
 * Each record is written in its own transaction: it survives a rollback of the
 * caller's transaction, and a failed write never marks the caller's transaction
 * rollback-only.
 */
@Slf4j
@Service
public class PaymentTransactionErrorService {

    private final PaymentTransactionErrorRepository errorRepository;
    private final TransactionTemplate requiresNewTemplate;

    public PaymentTransactionErrorService(PaymentTransactionErrorRepository errorRepository,
                                          PlatformTransactionManager transactionManager) {
        this.errorRepository = errorRepository;
        this.requiresNewTemplate = new TransactionTemplate(transactionManager);
        this.requiresNewTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Persists an error returned by a gateway endpoint. {@code transaction} is
     * set when the call happened after a transaction existed. The user and the
     * transaction must already be committed, since the record is written in a
     * separate transaction.
     *
     * @return the stored record, or empty if it could not be stored
     */
    public Optional<PaymentTransactionErrorEntity> recordError(UserAccountEntity user, String paypalApiUrl,
                                                               String requestData, String response,
                                                               PaymentTransactionEntity transaction) {
        if (user == null) {
            throw new IllegalArgumentException("Error record user is required");
        }
        try {
            Optional<PaymentTransactionErrorEntity> saved = Optional.ofNullable(requiresNewTemplate.execute(status ->
                    errorRepository.save(PaymentTransactionErrorEntity.builder()
                            .user(user)
                            .paypalApiUrl(paypalApiUrl)
                            .requestData(requestData)
                            .response(response)
                            .transaction(transaction)
                            .build())));
            saved.ifPresent(error -> log.warn("Recorded gateway error: id={}, url={}, transactionId={}",
                    error.getId(), paypalApiUrl, transaction != null ? transaction.getTransactionId() : null));
            return saved;
        } catch (Exception e) {
            log.error("Failed to persist gateway error: url={}, userId={}", paypalApiUrl, user.getId(), e);
            // The caller is already handling a failed call
            return Optional.empty();
        }
    }

    @Transactional(readOnly = true)
    public PaymentTransactionErrorEntity getError(Long id) {
        return errorRepository.findById(id)
                .orElseThrow(() -> RecordNotFoundException.of("PaymentTransactionError", id));
    }

    @Transactional(readOnly = true)
    public List<PaymentTransactionErrorEntity> listErrors() {
        return errorRepository.findAllNewestFirst();
    }

    @Transactional(readOnly = true)
    public List<PaymentTransactionErrorEntity> listErrors(UserAccountEntity user) {
        return errorRepository.findByUserNewestFirst(user);
    }

    @Transactional(readOnly = true)
    public List<PaymentTransactionErrorEntity> listErrors(PaymentTransactionEntity transaction) {
        return errorRepository.findByTransactionNewestFirst(transaction);
    }
}
