package com.bookwatch.monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * One crawled catalog entry as produced by the crawler.
 *
 * Field notes:
 *  - sourceUrl is the natural key; the item id is derived from it
 *  - availability is the raw label scraped from the page ("In stock", "Out of stock")
 *  - rating is 1..5 or null when the page carries no star rating
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Item {

    String name;
    String description;
    String category;

    BigDecimal priceIncludingTax;
    BigDecimal priceExcludingTax;

    String availability;
    Integer numberOfReviews;

    String imageUrl;
    Integer rating;

    String sourceUrl;

    /** True when the availability label reads as purchasable. */
    @JsonIgnore
    public boolean isInStock() {
        return availability != null && availability.trim().toLowerCase().startsWith("in stock");
    }
}
