package com.bookwatch.monitor.model;

public enum ChangeType {
    PRICE_CHANGE,
    AVAILABILITY_CHANGE,
    RATING_CHANGE,
    DESCRIPTION_CHANGE,
    IMAGE_CHANGE,
    REVIEWS_CHANGE,
    CATEGORY_CHANGE,
    NEW_ITEM,
    ITEM_REMOVED;

    /** Lower-case label used in exports and log lines, e.g. "price_change". */
    public String label() {
        return name().toLowerCase();
    }
}
