package com.bookwatch.monitor.service;

import com.bookwatch.monitor.model.Item;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Item fields covered by fingerprints, with their group and canonical text form.
 *
 * Declaration order inside a group is the precedence used when a group digest changes
 * and several of its fields differ.
 */
public enum TrackedField {

    NAME("name", FieldGroup.CONTENT, Item::getName),

    PRICE_INCLUDING_TAX("price_including_tax", FieldGroup.PRICE, Item::getPriceIncludingTax),
    PRICE_EXCLUDING_TAX("price_excluding_tax", FieldGroup.PRICE, Item::getPriceExcludingTax),

    AVAILABILITY("availability", FieldGroup.AVAILABILITY, Item::getAvailability),
    NUMBER_OF_REVIEWS("number_of_reviews", FieldGroup.AVAILABILITY, Item::getNumberOfReviews),

    CATEGORY("category", FieldGroup.METADATA, Item::getCategory),
    RATING("rating", FieldGroup.METADATA, Item::getRating),
    DESCRIPTION("description", FieldGroup.METADATA, Item::getDescription),
    IMAGE_URL("image_url", FieldGroup.METADATA, Item::getImageUrl);

    /** Stands in for a missing value so that "value went absent" still changes the digest. */
    public static final String ABSENT = "<absent>";

    private static final int PRICE_SCALE = 2;

    private final String key;
    private final FieldGroup group;
    private final Function<Item, Object> accessor;

    TrackedField(String key, FieldGroup group, Function<Item, Object> accessor) {
        this.key = key;
        this.group = group;
        this.accessor = accessor;
    }

    public String key() {
        return key;
    }

    public FieldGroup group() {
        return group;
    }

    /** Canonical text of this field for hashing; never null. */
    public String canonical(Item item) {
        return canonicalize(accessor.apply(item));
    }

    /** Canonical text for display in a change record; null when absent. */
    public String displayValue(Item item) {
        String value = canonical(item);
        return ABSENT.equals(value) ? null : value;
    }

    public static List<TrackedField> inGroup(FieldGroup group) {
        return Arrays.stream(values()).filter(f -> f.group == group).toList();
    }

    static String canonicalize(Object value) {
        if (value == null) {
            return ABSENT;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.setScale(PRICE_SCALE, RoundingMode.HALF_EVEN).toPlainString();
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        }
        String text = Normalizer.normalize(value.toString(), Normalizer.Form.NFC).trim();
        return text.isEmpty() ? ABSENT : text;
    }
}
