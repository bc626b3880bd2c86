package com.bookwatch.monitor.service;

import com.bookwatch.monitor.TestItems;
import com.bookwatch.monitor.model.ChangeType;
import com.bookwatch.monitor.model.Item;
import com.bookwatch.monitor.model.Severity;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangePolicyTest {

    private final ChangePolicy policy = ChangePolicy.standard(0.10);

    @Test
    void priceDeltaAtThresholdEscalates() {
        Item before = TestItems.book().toBuilder().priceIncludingTax(new BigDecimal("50.00")).build();
        Item exactlyTen = before.toBuilder().priceIncludingTax(new BigDecimal("45.00")).build();
        Item justUnder = before.toBuilder().priceIncludingTax(new BigDecimal("45.01")).build();

        ChangePolicy.Rule rule = policy.ruleFor(TrackedField.PRICE_INCLUDING_TAX);

        assertThat(rule.type()).isEqualTo(ChangeType.PRICE_CHANGE);
        assertThat(rule.severity(before, exactlyTen)).isEqualTo(Severity.HIGH);
        assertThat(rule.severity(before, justUnder)).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void priceFromZeroIsHigh() {
        Item before = TestItems.book().toBuilder().priceIncludingTax(BigDecimal.ZERO).build();
        Item after = before.toBuilder().priceIncludingTax(new BigDecimal("1.00")).build();

        assertThat(policy.ruleFor(TrackedField.PRICE_INCLUDING_TAX).severity(before, after)).isEqualTo(Severity.HIGH);
    }

    @Test
    void stockFlipEscalatesAvailability() {
        Item inStock = TestItems.book();
        Item fewerLeft = inStock.toBuilder().availability("In stock (3 available)").build();
        Item soldOut = inStock.toBuilder().availability("Out of stock").build();

        ChangePolicy.Rule rule = policy.ruleFor(TrackedField.AVAILABILITY);

        assertThat(rule.severity(inStock, fewerLeft)).isEqualTo(Severity.LOW);
        assertThat(rule.severity(inStock, soldOut)).isEqualTo(Severity.HIGH);
        assertThat(rule.severity(soldOut, inStock)).isEqualTo(Severity.HIGH);
    }

    @Test
    void metadataRules() {
        assertThat(policy.ruleFor(TrackedField.CATEGORY).baseSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(policy.ruleFor(TrackedField.RATING).type()).isEqualTo(ChangeType.RATING_CHANGE);
        assertThat(policy.ruleFor(TrackedField.IMAGE_URL).type()).isEqualTo(ChangeType.IMAGE_CHANGE);
        assertThat(policy.ruleFor(TrackedField.NAME).baseSeverity()).isEqualTo(Severity.HIGH);
        assertThat(policy.newItemSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(policy.removedItemSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void incompleteTableIsRejected() {
        assertThatThrownBy(() -> new ChangePolicy(Map.of(), Map.of(), Severity.MEDIUM, Severity.HIGH))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name");
    }
}
