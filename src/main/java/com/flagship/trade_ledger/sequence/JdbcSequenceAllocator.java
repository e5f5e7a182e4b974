package com.flagship.trade_ledger.sequence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Sequence allocation backed by a single PostgreSQL upsert.
 *
 * The row lock taken by {@code ON CONFLICT DO UPDATE} serialises concurrent
 * increments of the same counter, so no read-modify-write happens in Java.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcSequenceAllocator implements SequenceAllocator {

    private static final String NEXT_SQL = """
        INSERT INTO sequences (name, value, created_at, updated_at)
        VALUES (?, 1, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        ON CONFLICT (name) DO UPDATE
            SET value = sequences.value + 1,
                updated_at = CURRENT_TIMESTAMP
        RETURNING value
        """;

    private static final String CURRENT_SQL = "SELECT value FROM sequences WHERE name = ?";

    private final JdbcTemplate jdbcTemplate;

    @Override
    @Transactional
    public long next(String name) {
        requireName(name);
        Long value = jdbcTemplate.queryForObject(NEXT_SQL, Long.class, name);
        if (value == null) {
            throw new IllegalStateException("Sequence upsert returned no value: " + name);
        }
        log.debug("Sequence allocated: name={}, value={}", name, value);
        return value;
    }

    @Override
    @Transactional(readOnly = true)
    public long peek(String name) {
        requireName(name);
        List<Long> current = jdbcTemplate.queryForList(CURRENT_SQL, Long.class, name);
        return (current.isEmpty() ? 0L : current.get(0)) + 1;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sequence name is required");
        }
    }
}
