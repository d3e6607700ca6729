package com.payment.checkout.persistence.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * An item on sale. Carries what the gateway needs to describe a line of the
 * checkout: name, description and price.
 */
@Entity
@Table(name = "items", indexes = {
    @Index(name = "idx_item_identifier", columnList = "identifier")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemEntity implements ReferenceableEntity {

    public static final String DEFAULT_CURRENCY = "USD";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Size(max = 256)
    @Column(name = "identifier", length = 256)
    private String identifier;

    @NotBlank
    @Size(max = 2048)
    @Column(name = "name", nullable = false, length = 2048)
    private String name;

    @NotBlank
    @Size(max = 4000)
    @Column(name = "description", nullable = false, length = 4000)
    private String description;

    @NotNull
    @Digits(integer = 6, fraction = 2)
    @Column(name = "value", nullable = false, precision = 8, scale = 2)
    private BigDecimal value;

    @Size(max = 16)
    @Column(name = "currency", nullable = false, length = 16)
    @Builder.Default
    private String currency = DEFAULT_CURRENCY;

    @Override
    public String toString() {
        return String.format("%s - %s %s", name, value, currency);
    }
}
