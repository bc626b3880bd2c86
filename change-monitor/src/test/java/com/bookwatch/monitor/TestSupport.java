package com.bookwatch.monitor;

import com.bookwatch.monitor.output.MonitorSchema;
import com.bookwatch.monitor.service.TransientStoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;

/** Wiring shared by store and flow tests. */
public final class TestSupport {

    private TestSupport() {
    }

    /** Fresh in-memory H2 database with the monitor schema applied. */
    public static JdbcTemplate h2WithSchema() {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .build());
        new MonitorSchema(jdbcTemplate).ensureSchema();
        return jdbcTemplate;
    }

    /** Transactions over the same data source the template writes to. */
    public static TransactionTemplate transactionTemplate(JdbcTemplate jdbcTemplate) {
        return new TransactionTemplate(new DataSourceTransactionManager(jdbcTemplate.getDataSource()));
    }

    public static ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public static Retry fastRetry() {
        return Retry.of("test", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(TransientStoreException.class)
                .build());
    }
}
