package com.payment.checkout.persistence.service;

import com.payment.checkout.persistence.entity.ItemEntity;
import com.payment.checkout.persistence.repository.ItemRepository;
import com.payment.checkout.persistence.repository.PurchasedItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Catalog management for items on sale.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ItemCatalogService {

    private final ItemRepository itemRepository;
    private final PurchasedItemRepository purchasedItemRepository;

    @Value("${payment.checkout.default-currency:" + ItemEntity.DEFAULT_CURRENCY + "}")
    private String defaultCurrency = ItemEntity.DEFAULT_CURRENCY;

    /**
     * Creates an item. A blank currency falls back to the configured default.
     */
    @Transactional
    public ItemEntity createItem(String identifier, String name, String description, BigDecimal value, String currency) {
        requireText(name, "name");
        requireText(description, "description");
        if (value == null) {
            throw new IllegalArgumentException("Item value is required");
        }
        ItemEntity item = ItemEntity.builder()
                .identifier(identifier != null ? identifier : "")
                .name(name)
                .description(description)
                .value(value)
                .currency(currency == null || currency.isBlank() ? defaultCurrency : currency)
                .build();
        ItemEntity saved = itemRepository.save(item);
        log.debug("Created item: id={}, identifier={}, value={} {}",
                saved.getId(), saved.getIdentifier(), saved.getValue(), saved.getCurrency());
        return saved;
    }

    /**
     * Updates an item. Null arguments leave the field unchanged. Existing
     * purchases keep the price they were recorded with.
     */
    @Transactional
    public ItemEntity updateItem(Long id, String name, String description, BigDecimal value, String currency) {
        ItemEntity item = getItem(id);
        if (name != null) {
            requireText(name, "name");
            item.setName(name);
        }
        if (description != null) {
            requireText(description, "description");
            item.setDescription(description);
        }
        if (value != null) {
            item.setValue(value);
        }
        if (currency != null && !currency.isBlank()) {
            item.setCurrency(currency);
        }
        ItemEntity saved = itemRepository.save(item);
        log.debug("Updated item: id={}, value={} {}", id, saved.getValue(), saved.getCurrency());
        return saved;
    }

    @Transactional(readOnly = true)
    public ItemEntity getItem(Long id) {
        return itemRepository.findById(id)
                .orElseThrow(() -> RecordNotFoundException.of("Item", id));
    }

    @Transactional(readOnly = true)
    public List<ItemEntity> findByIdentifier(String identifier) {
        return itemRepository.findByIdentifier(identifier);
    }

    @Transactional(readOnly = true)
    public List<ItemEntity> listItems() {
        return itemRepository.findAllByOrderByNameAsc();
    }

    /**
     * Deletes an item that no purchase references.
     */
    @Transactional
    public void deleteItem(Long id) {
        ItemEntity item = getItem(id);
        if (purchasedItemRepository.existsByItemId(id)) {
            log.warn("Refusing to delete item with purchases: id={}", id);
            throw new RecordInUseException("Item " + id + " is referenced by purchased items");
        }
        itemRepository.delete(item);
        log.info("Deleted item: id={}, name={}", id, item.getName());
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Item " + field + " is required");
        }
    }
}
