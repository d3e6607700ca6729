package com.payment.checkout.persistence.entity;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelatedObjectRefTest {

    @Test
    void toEntityUsesRegisteredTypeAndId() {
        ItemEntity item = ItemEntity.builder().id(7L).name("Ticket").description("Entry").value(new BigDecimal("5.00")).build();

        RelatedObjectRef ref = RelatedObjectRef.to(item);

        assertThat(ref.getType()).isEqualTo(RelatedObjectType.ITEM);
        assertThat(ref.getObjectId()).isEqualTo(7L);
        assertThat(ref).isEqualTo(RelatedObjectRef.of(RelatedObjectType.ITEM, 7L));
        assertThat(ref.toString()).isEqualTo("ITEM#7");
    }

    @Test
    void ofRequiresBothHalves() {
        assertThatThrownBy(() -> RelatedObjectRef.of(null, 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RelatedObjectRef.of(RelatedObjectType.ITEM, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ofRejectsNegativeObjectId() {
        assertThatThrownBy(() -> RelatedObjectRef.of(RelatedObjectType.USER_ACCOUNT, -1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void toRejectsUnsavedEntity() {
        assertThatThrownBy(() -> RelatedObjectRef.to(new UserAccountEntity()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
