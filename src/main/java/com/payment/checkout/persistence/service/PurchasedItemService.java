package com.payment.checkout.persistence.service;

import com.payment.checkout.persistence.entity.ItemEntity;
import com.payment.checkout.persistence.entity.PaymentTransactionEntity;
import com.payment.checkout.persistence.entity.PurchasedItemEntity;
import com.payment.checkout.persistence.entity.UserAccountEntity;
import com.payment.checkout.persistence.repository.PurchasedItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records which user bought what with which transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PurchasedItemService {

    private final PurchasedItemRepository purchasedItemRepository;

    /**
     * Persists a purchase line. The price is captured now so later catalog
     * price changes do not rewrite past purchases.
     */
    @Transactional
    public PurchasedItemEntity recordPurchase(PurchaseRequest request) {
        if (request.getUser() == null || request.getTransaction() == null) {
            throw new IllegalArgumentException("Purchase needs a user and a transaction");
        }
        if (request.getQuantity() == null || request.getQuantity() <= 0) {
            throw new IllegalArgumentException("Purchase quantity must be a positive integer, got " + request.getQuantity());
        }
        Double price = request.getPrice();
        if (price == null && request.getItem() != null) {
            price = request.getItem().getValue().doubleValue();
        }
        PurchasedItemEntity entity = PurchasedItemEntity.builder()
                .user(request.getUser())
                .transaction(request.getTransaction())
                .item(request.getItem())
                .related(request.getRelated())
                .identifier(request.getIdentifier() != null ? request.getIdentifier() : "")
                .price(price)
                .quantity(request.getQuantity())
                .build();
        PurchasedItemEntity saved = purchasedItemRepository.save(entity);
        log.debug("Recorded purchase: id={}, transactionId={}, identifier={}, quantity={}, price={}",
                saved.getId(), request.getTransaction().getTransactionId(), saved.getIdentifier(),
                saved.getQuantity(), saved.getPrice());
        return saved;
    }

    @Transactional(readOnly = true)
    public PurchasedItemEntity getPurchase(Long id) {
        return purchasedItemRepository.findById(id)
                .orElseThrow(() -> RecordNotFoundException.of("PurchasedItem", id));
    }

    @Transactional(readOnly = true)
    public List<PurchasedItemEntity> listPurchases() {
        return purchasedItemRepository.findAllOrdered();
    }

    @Transactional(readOnly = true)
    public List<PurchasedItemEntity> listPurchases(UserAccountEntity user) {
        return purchasedItemRepository.findByUserOrdered(user);
    }

    @Transactional(readOnly = true)
    public List<PurchasedItemEntity> listPurchases(PaymentTransactionEntity transaction) {
        return purchasedItemRepository.findByTransactionOrderByIdAsc(transaction);
    }

    @Transactional(readOnly = true)
    public boolean hasPurchased(UserAccountEntity user, ItemEntity item) {
        if (user == null || item == null) {
            throw new IllegalArgumentException("Purchase lookup needs a user and an item");
        }
        return purchasedItemRepository.existsByUserAndItem(user, item);
    }

    /**
     * Sums {@code price * quantity} per identifier within one transaction, e.g.
     * to separate shipping costs from the cost of goods. Lines without a price
     * are left out; an identifier with no priced line maps to 0.
     */
    @Transactional(readOnly = true)
    public Map<String, Double> totalsByIdentifier(PaymentTransactionEntity transaction) {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (PurchasedItemRepository.IdentifierTotal row : purchasedItemRepository.sumTotalsByIdentifier(transaction)) {
            totals.put(row.getIdentifier(), row.getTotal() != null ? row.getTotal() : 0d);
        }
        return totals;
    }

    @Transactional
    public void deletePurchase(Long id) {
        PurchasedItemEntity entity = getPurchase(id);
        purchasedItemRepository.delete(entity);
        log.info("Deleted purchase: id={}", id);
    }
}
