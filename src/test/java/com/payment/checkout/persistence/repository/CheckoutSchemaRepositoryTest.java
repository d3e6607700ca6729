package com.payment.checkout.persistence.repository;

import com.payment.checkout.domain.PaymentStatus;
import com.payment.checkout.persistence.entity.ItemEntity;
import com.payment.checkout.persistence.entity.PaymentTransactionEntity;
import com.payment.checkout.persistence.entity.PaymentTransactionErrorEntity;
import com.payment.checkout.persistence.entity.PurchasedItemEntity;
import com.payment.checkout.persistence.entity.RelatedObjectRef;
import com.payment.checkout.persistence.entity.RelatedObjectType;
import com.payment.checkout.persistence.entity.UserAccountEntity;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Schema behaviour against an in-memory H2 database: generated timestamps,
 * default orderings, foreign-key restrictions and the write-once error log.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class CheckoutSchemaRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private UserAccountRepository userRepository;

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private PaymentTransactionRepository transactionRepository;

    @Autowired
    private PurchasedItemRepository purchasedItemRepository;

    @Autowired
    private PaymentTransactionErrorRepository errorRepository;

    private UserAccountEntity user;

    @BeforeEach
    void setUp() {
        user = userRepository.save(UserAccountEntity.builder()
                .username("buyer")
                .email("buyer@example.com")
                .build());
    }

    @Test
    void creationDateIsGeneratedOnceAndNeverRewritten() {
        PaymentTransactionEntity saved = transactionRepository.save(transaction("EC-1", null));
        entityManager.flush();
        entityManager.clear();

        PaymentTransactionEntity loaded = transactionRepository.findById(saved.getId()).orElseThrow();
        Instant creationDate = loaded.getCreationDate();
        Instant firstSave = loaded.getDate();
        assertThat(creationDate).isNotNull();

        loaded.setCreationDate(creationDate.minus(30, ChronoUnit.DAYS));
        loaded.setStatus(PaymentStatus.COMPLETED);
        transactionRepository.saveAndFlush(loaded);
        entityManager.clear();

        PaymentTransactionEntity reloaded = transactionRepository.findById(saved.getId()).orElseThrow();
        assertThat(reloaded.getCreationDate()).isEqualTo(creationDate);
        assertThat(reloaded.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(reloaded.getDate()).isAfterOrEqualTo(firstSave);
    }

    @Test
    void explicitCreationDateIsKept() {
        Instant created = Instant.parse("2024-03-01T10:15:30Z");

        PaymentTransactionEntity saved = transactionRepository.saveAndFlush(transaction("EC-2", created));
        entityManager.clear();

        assertThat(transactionRepository.findById(saved.getId()).orElseThrow().getCreationDate()).isEqualTo(created);
    }

    @Test
    void transactionsAreOrderedByCreationDateDescThenTransactionId() {
        Instant earlier = Instant.parse("2024-01-01T00:00:00Z");
        Instant later = Instant.parse("2024-02-01T00:00:00Z");
        transactionRepository.save(transaction("B", earlier));
        transactionRepository.save(transaction("A", earlier));
        transactionRepository.save(transaction("C", later));
        entityManager.flush();
        entityManager.clear();

        List<String> ordered = transactionRepository.findAllOrdered().stream()
                .map(PaymentTransactionEntity::getTransactionId)
                .toList();

        assertThat(ordered).containsExactly("C", "A", "B");
    }

    @Test
    void statusIsStoredAsItsWireValue() {
        PaymentTransactionEntity saved = transactionRepository.saveAndFlush(transaction("EC-3", null));

        String stored = jdbcTemplate.queryForObject(
                "SELECT status FROM payment_transactions WHERE id = ?", String.class, saved.getId());

        assertThat(stored).isEqualTo("pending");
    }

    @Test
    void purchasedItemWithNonPositiveQuantityIsRejected() {
        PaymentTransactionEntity tx = transactionRepository.save(transaction("EC-4", null));

        assertThatThrownBy(() -> purchasedItemRepository.saveAndFlush(PurchasedItemEntity.builder()
                .user(user)
                .transaction(tx)
                .quantity(0)
                .build()))
                .isInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void quantityCheckConstraintBacksUpValidation() {
        PaymentTransactionEntity tx = transactionRepository.saveAndFlush(transaction("EC-5", null));

        assertThatThrownBy(() -> jdbcTemplate.update(
                "INSERT INTO purchased_items (user_id, transaction_id, quantity) VALUES (?, ?, ?)",
                user.getId(), tx.getId(), -1))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void negativeRelatedObjectIdIsRejected() {
        RelatedObjectRef related = RelatedObjectRef.of(RelatedObjectType.ITEM, 1L);
        ReflectionTestUtils.setField(related, "objectId", -5L);
        PaymentTransactionEntity tx = transaction("EC-10", null);
        tx.setRelated(related);

        assertThatThrownBy(() -> transactionRepository.saveAndFlush(tx))
                .isInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void halfSetRelatedReferenceIsRejected() {
        RelatedObjectRef related = RelatedObjectRef.of(RelatedObjectType.ITEM, 1L);
        ReflectionTestUtils.setField(related, "objectId", null);
        PaymentTransactionEntity tx = transactionRepository.save(transaction("EC-11", null));

        assertThatThrownBy(() -> purchasedItemRepository.saveAndFlush(PurchasedItemEntity.builder()
                .user(user)
                .transaction(tx)
                .related(related)
                .quantity(1)
                .build()))
                .isInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void relatedColumnCheckConstraintBacksUpValidation() {
        entityManager.flush();

        assertThatThrownBy(() -> jdbcTemplate.update(
                "INSERT INTO payment_transactions (user_id, date, transaction_id, value, status, content_type) "
                        + "VALUES (?, CURRENT_TIMESTAMP, 'EC-12', 1.00, 'pending', 'ITEM')",
                user.getId()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void deletingTransactionWithPurchasedItemsViolatesForeignKey() {
        PaymentTransactionEntity tx = transactionRepository.save(transaction("EC-6", null));
        purchasedItemRepository.save(PurchasedItemEntity.builder()
                .user(user)
                .transaction(tx)
                .identifier("goods")
                .price(5.0)
                .quantity(1)
                .build());
        entityManager.flush();
        entityManager.clear();

        assertThatThrownBy(() -> jdbcTemplate.update("DELETE FROM payment_transactions WHERE id = ?", tx.getId()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void purchasedItemsAreOrderedByTransactionDateDescThenTransactionId() {
        PaymentTransactionEntity older = transactionRepository.saveAndFlush(transaction("OLD", null));
        PaymentTransactionEntity newer = transactionRepository.saveAndFlush(transaction("NEW", null));
        purchasedItemRepository.save(purchase(older, "goods", 1));
        purchasedItemRepository.save(purchase(newer, "goods", 2));
        entityManager.flush();
        // Pin the transaction dates so ordering does not depend on clock resolution
        jdbcTemplate.update("UPDATE payment_transactions SET date = ? WHERE id = ?",
                java.sql.Timestamp.from(Instant.parse("2024-01-01T00:00:00Z")), older.getId());
        jdbcTemplate.update("UPDATE payment_transactions SET date = ? WHERE id = ?",
                java.sql.Timestamp.from(Instant.parse("2024-06-01T00:00:00Z")), newer.getId());
        entityManager.clear();

        List<Integer> quantities = purchasedItemRepository.findAllOrdered().stream()
                .map(PurchasedItemEntity::getQuantity)
                .toList();

        assertThat(quantities).containsExactly(2, 1);
    }

    @Test
    void totalsAreSummedPerIdentifier() {
        PaymentTransactionEntity tx = transactionRepository.save(transaction("EC-7", null));
        PurchasedItemEntity goods = purchase(tx, "goods", 2);
        goods.setPrice(10.0);
        PurchasedItemEntity moreGoods = purchase(tx, "goods", 1);
        moreGoods.setPrice(5.5);
        PurchasedItemEntity shipping = purchase(tx, "shipping", 1);
        shipping.setPrice(4.0);
        purchasedItemRepository.saveAll(List.of(goods, moreGoods, shipping));
        entityManager.flush();

        List<PurchasedItemRepository.IdentifierTotal> totals = purchasedItemRepository.sumTotalsByIdentifier(tx);

        assertThat(totals).extracting(PurchasedItemRepository.IdentifierTotal::getIdentifier)
                .containsExactly("goods", "shipping");
        assertThat(totals).extracting(PurchasedItemRepository.IdentifierTotal::getTotal)
                .containsExactly(25.5, 4.0);
    }

    @Test
    void userAndItemPurchaseLookup() {
        ItemEntity item = itemRepository.save(ItemEntity.builder()
                .name("Poster").description("A2 print").value(new BigDecimal("12.00")).build());
        ItemEntity other = itemRepository.save(ItemEntity.builder()
                .name("Mug").description("Ceramic").value(new BigDecimal("8.00")).build());
        PaymentTransactionEntity tx = transactionRepository.save(transaction("EC-8", null));
        PurchasedItemEntity line = purchase(tx, "", 1);
        line.setItem(item);
        purchasedItemRepository.save(line);
        entityManager.flush();

        assertThat(purchasedItemRepository.existsByUserAndItem(user, item)).isTrue();
        assertThat(purchasedItemRepository.existsByUserAndItem(user, other)).isFalse();
        assertThat(purchasedItemRepository.existsByItemId(item.getId())).isTrue();
    }

    @Test
    void errorRecordIsNotMutatedByLaterChanges() {
        PaymentTransactionEntity tx = transactionRepository.save(transaction("EC-9", null));
        PaymentTransactionErrorEntity saved = errorRepository.save(PaymentTransactionErrorEntity.builder()
                .user(user)
                .paypalApiUrl("https://api-3t.sandbox.paypal.com/nvp")
                .requestData("METHOD=SetExpressCheckout")
                .response("ACK=Failure")
                .transaction(tx)
                .build());
        entityManager.flush();
        entityManager.clear();

        PaymentTransactionErrorEntity loaded = errorRepository.findById(saved.getId()).orElseThrow();
        Instant date = loaded.getDate();
        ReflectionTestUtils.setField(loaded, "response", "ACK=Success");
        ReflectionTestUtils.setField(loaded, "paypalApiUrl", "https://elsewhere");
        entityManager.flush();
        entityManager.clear();

        PaymentTransactionErrorEntity reloaded = errorRepository.findById(saved.getId()).orElseThrow();
        assertThat(date).isNotNull();
        assertThat(reloaded.getDate()).isEqualTo(date);
        assertThat(reloaded.getResponse()).isEqualTo("ACK=Failure");
        assertThat(reloaded.getPaypalApiUrl()).isEqualTo("https://api-3t.sandbox.paypal.com/nvp");
        assertThat(errorRepository.countByTransactionId(tx.getId())).isEqualTo(1);
    }

    @Test
    void errorRepositoryExposesNoDeleteOrUpdate() {
        List<String> methodNames = Arrays.stream(PaymentTransactionErrorRepository.class.getMethods())
                .map(Method::getName)
                .toList();

        assertThat(methodNames).noneMatch(name -> name.startsWith("delete") || name.startsWith("update"));
    }

    private PaymentTransactionEntity transaction(String transactionId, Instant creationDate) {
        return PaymentTransactionEntity.builder()
                .user(user)
                .transactionId(transactionId)
                .value(new BigDecimal("20.00"))
                .status(PaymentStatus.PENDING)
                .creationDate(creationDate)
                .build();
    }

    private PurchasedItemEntity purchase(PaymentTransactionEntity tx, String identifier, int quantity) {
        return PurchasedItemEntity.builder()
                .user(user)
                .transaction(tx)
                .identifier(identifier)
                .quantity(quantity)
                .build();
    }
}
