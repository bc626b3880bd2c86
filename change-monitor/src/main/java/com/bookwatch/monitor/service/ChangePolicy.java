package com.bookwatch.monitor.service;

import com.bookwatch.monitor.model.ChangeType;
import com.bookwatch.monitor.model.Item;
import com.bookwatch.monitor.model.Severity;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Declarative classification table: which change type each tracked field maps to, its
 * base severity, and the condition that escalates it to HIGH.
 *
 * Hash-only rules apply when a group digest changed but the previous raw values are
 * not available to tell which field moved.
 */
public class ChangePolicy {

    public record Rule(ChangeType type, Severity baseSeverity, BiPredicate<Item, Item> escalatesWhen) {

        static Rule fixed(ChangeType type, Severity severity) {
            return new Rule(type, severity, (before, after) -> false);
        }

        public Severity severity(Item before, Item after) {
            return escalatesWhen.test(before, after) ? Severity.max(baseSeverity, Severity.HIGH) : baseSeverity;
        }
    }

    private final Map<TrackedField, Rule> fieldRules;
    private final Map<FieldGroup, Rule> hashOnlyRules;
    private final Severity newItemSeverity;
    private final Severity removedItemSeverity;

    public ChangePolicy(Map<TrackedField, Rule> fieldRules, Map<FieldGroup, Rule> hashOnlyRules,
                        Severity newItemSeverity, Severity removedItemSeverity) {
        for (TrackedField field : TrackedField.values()) {
            if (!fieldRules.containsKey(field)) {
                throw new IllegalArgumentException("No rule for tracked field " + field.key());
            }
        }
        for (FieldGroup group : FieldGroup.values()) {
            if (!hashOnlyRules.containsKey(group)) {
                throw new IllegalArgumentException("No hash-only rule for group " + group);
            }
        }
        this.fieldRules = new EnumMap<>(fieldRules);
        this.hashOnlyRules = new EnumMap<>(hashOnlyRules);
        this.newItemSeverity = newItemSeverity;
        this.removedItemSeverity = removedItemSeverity;
    }

    /**
     * The standard catalog policy:
     * <ul>
     *   <li>price: MEDIUM, HIGH when the relative delta reaches {@code priceChangeThreshold}</li>
     *   <li>availability: LOW, HIGH when the item flips between in stock and out of stock</li>
     *   <li>category: MEDIUM; rating, description, image, review count: LOW</li>
     *   <li>name: HIGH, reported as a description change on field "name"</li>
     * </ul>
     */
    public static ChangePolicy standard(double priceChangeThreshold) {
        Map<TrackedField, Rule> rules = new EnumMap<>(TrackedField.class);
        rules.put(TrackedField.NAME, Rule.fixed(ChangeType.DESCRIPTION_CHANGE, Severity.HIGH));
        rules.put(TrackedField.PRICE_INCLUDING_TAX, new Rule(ChangeType.PRICE_CHANGE, Severity.MEDIUM,
                priceMovedBy(Item::getPriceIncludingTax, priceChangeThreshold)));
        rules.put(TrackedField.PRICE_EXCLUDING_TAX, new Rule(ChangeType.PRICE_CHANGE, Severity.MEDIUM,
                priceMovedBy(Item::getPriceExcludingTax, priceChangeThreshold)));
        rules.put(TrackedField.AVAILABILITY, new Rule(ChangeType.AVAILABILITY_CHANGE, Severity.LOW,
                (before, after) -> before.isInStock() != after.isInStock()));
        rules.put(TrackedField.NUMBER_OF_REVIEWS, Rule.fixed(ChangeType.REVIEWS_CHANGE, Severity.LOW));
        rules.put(TrackedField.CATEGORY, Rule.fixed(ChangeType.CATEGORY_CHANGE, Severity.MEDIUM));
        rules.put(TrackedField.RATING, Rule.fixed(ChangeType.RATING_CHANGE, Severity.LOW));
        rules.put(TrackedField.DESCRIPTION, Rule.fixed(ChangeType.DESCRIPTION_CHANGE, Severity.LOW));
        rules.put(TrackedField.IMAGE_URL, Rule.fixed(ChangeType.IMAGE_CHANGE, Severity.LOW));

        Map<FieldGroup, Rule> hashOnly = new EnumMap<>(FieldGroup.class);
        hashOnly.put(FieldGroup.PRICE, Rule.fixed(ChangeType.PRICE_CHANGE, Severity.MEDIUM));
        hashOnly.put(FieldGroup.AVAILABILITY, Rule.fixed(ChangeType.AVAILABILITY_CHANGE, Severity.LOW));
        hashOnly.put(FieldGroup.METADATA, Rule.fixed(ChangeType.DESCRIPTION_CHANGE, Severity.LOW));
        hashOnly.put(FieldGroup.CONTENT, Rule.fixed(ChangeType.DESCRIPTION_CHANGE, Severity.HIGH));

        return new ChangePolicy(rules, hashOnly, Severity.MEDIUM, Severity.HIGH);
    }

    public Rule ruleFor(TrackedField field) {
        return fieldRules.get(field);
    }

    public Rule hashOnlyRuleFor(FieldGroup group) {
        return hashOnlyRules.get(group);
    }

    public Severity newItemSeverity() {
        return newItemSeverity;
    }

    public Severity removedItemSeverity() {
        return removedItemSeverity;
    }

    /** True when the relative delta is at least the threshold, or the old price is missing or zero. */
    static BiPredicate<Item, Item> priceMovedBy(Function<Item, BigDecimal> price, double threshold) {
        BigDecimal limit = BigDecimal.valueOf(threshold);
        return (before, after) -> {
            BigDecimal oldPrice = price.apply(before);
            BigDecimal newPrice = price.apply(after);
            if (oldPrice == null || newPrice == null || oldPrice.signum() == 0) {
                return true;
            }
            BigDecimal relative = newPrice.subtract(oldPrice).abs().divide(oldPrice.abs(), MathContext.DECIMAL64);
            return relative.compareTo(limit) >= 0;
        };
    }
}
