package com.bookwatch.monitor.service;

import com.bookwatch.monitor.model.Item;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads the current catalog from the crawler's books table, one row per source_url.
 *
 * Each call re-reads the table; nothing is cached between runs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CatalogItemSource {

    private final JdbcTemplate jdbcTemplate;

    @Retry(name = "catalogSource")
    public List<Item> fetchCurrentItemBatch() {
        String sql = """
            SELECT
                name, description, category,
                price_including_tax, price_excluding_tax,
                availability, number_of_reviews,
                image_url, rating, source_url
            FROM books
            ORDER BY source_url
            """;

        List<Item> items = jdbcTemplate.query(sql, (rs, rowNum) -> Item.builder()
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .category(rs.getString("category"))
                .priceIncludingTax(rs.getBigDecimal("price_including_tax"))
                .priceExcludingTax(rs.getBigDecimal("price_excluding_tax"))
                .availability(rs.getString("availability"))
                .numberOfReviews(rs.getObject("number_of_reviews", Integer.class))
                .imageUrl(rs.getString("image_url"))
                .rating(rs.getObject("rating", Integer.class))
                .sourceUrl(rs.getString("source_url"))
                .build());

        log.info("Loaded {} catalog items", items.size());
        return items;
    }
}
