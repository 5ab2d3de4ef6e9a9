package com.drinkjoy.catalog.infrastructure.persistence;

import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.model.CatalogStats;
import com.drinkjoy.catalog.domain.model.DrinkCategory;
import com.drinkjoy.catalog.domain.port.out.CatalogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL mirror of the catalog, one row per item with the item serialized as JSON.
 * Pure database operations without caching concerns.
 */
@Repository
public class JdbcCatalogRepository implements CatalogRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcCatalogRepository.class);

    static final int BATCH_SIZE = 100;

    private static final String INSERT_SQL = """
            INSERT INTO drink_catalog (id, category, data, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcCatalogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public List<CatalogItem> getAll() {
        String sql = """
            SELECT data FROM drink_catalog
            ORDER BY category, id
            """;
        try {
            return withoutUnreadable(jdbcTemplate.query(sql, itemRowMapper()));
        } catch (DataAccessException e) {
            logger.error("Database error while reading catalog", e);
            return Collections.emptyList();
        }
    }

    @Override
    public List<CatalogItem> getByCategory(DrinkCategory category) {
        String sql = """
            SELECT data FROM drink_catalog
            WHERE category = ?
            ORDER BY id
            """;
        try {
            return withoutUnreadable(jdbcTemplate.query(sql, itemRowMapper(), category.value()));
        } catch (DataAccessException e) {
            logger.error("Database error while reading category {}", category.value(), e);
            return Collections.emptyList();
        }
    }

    @Override
    public Optional<CatalogItem> getById(String id) {
        String sql = "SELECT data FROM drink_catalog WHERE id = ?";
        try {
            return withoutUnreadable(jdbcTemplate.query(sql, itemRowMapper(), id)).stream().findFirst();
        } catch (DataAccessException e) {
            logger.error("Database error while reading item {}", id, e);
            return Optional.empty();
        }
    }

    @Override
    public boolean replaceAll(List<CatalogItem> items) {
        try {
            int deleted = jdbcTemplate.update("DELETE FROM drink_catalog");
            int inserted = insertInBatches(items);
            logger.info("Catalog replaced: {} rows removed, {} items stored", deleted, inserted);
            return true;
        } catch (DataAccessException | IllegalStateException e) {
            logger.error("Failed to replace catalog with {} items", items.size(), e);
            return false;
        }
    }

    @Override
    public boolean replaceCategory(DrinkCategory category, List<CatalogItem> items) {
        List<CatalogItem> scoped = items.stream()
                .filter(item -> item.category() == category)
                .toList();
        if (scoped.size() != items.size()) {
            logger.warn("Ignoring {} items outside category {}", items.size() - scoped.size(), category.value());
        }

        try {
            int deleted = jdbcTemplate.update("DELETE FROM drink_catalog WHERE category = ?", category.value());
            int inserted = insertInBatches(scoped);
            logger.info("Category {} replaced: {} rows removed, {} items stored", category.value(), deleted, inserted);
            return true;
        } catch (DataAccessException | IllegalStateException e) {
            logger.error("Failed to replace category {}", category.value(), e);
            return false;
        }
    }

    @Override
    public CatalogStats getStats() {
        String sql = """
            SELECT category, COUNT(*) AS item_count, MAX(updated_at) AS last_updated
            FROM drink_catalog
            GROUP BY category
            """;
        try {
            Map<String, Integer> counts = new LinkedHashMap<>();
            List<Instant> updates = new ArrayList<>();
            jdbcTemplate.query(sql, rs -> {
                counts.put(rs.getString("category"), rs.getInt("item_count"));
                Timestamp lastUpdated = rs.getTimestamp("last_updated");
                if (lastUpdated != null) {
                    updates.add(lastUpdated.toInstant());
                }
            });
            int total = counts.values().stream().mapToInt(Integer::intValue).sum();
            Instant lastUpdated = updates.stream().max(Instant::compareTo).orElse(null);
            return new CatalogStats(total, counts, lastUpdated);
        } catch (DataAccessException e) {
            logger.error("Database error while computing catalog stats", e);
            return CatalogStats.empty();
        }
    }

    @Override
    public boolean isHealthy(long maxAgeMinutes) {
        String sql = "SELECT COUNT(*) AS item_count, MAX(updated_at) AS last_updated FROM drink_catalog";
        try {
            return Boolean.TRUE.equals(jdbcTemplate.query(sql, rs -> {
                if (!rs.next() || rs.getLong("item_count") == 0) {
                    return false;
                }
                Timestamp lastUpdated = rs.getTimestamp("last_updated");
                if (lastUpdated == null) {
                    return false;
                }
                Duration age = Duration.between(lastUpdated.toInstant(), clock.instant());
                return age.compareTo(Duration.ofMinutes(maxAgeMinutes)) <= 0;
            }));
        } catch (DataAccessException e) {
            logger.error("Database error while checking catalog health", e);
            return false;
        }
    }

    @Override
    public boolean clear() {
        try {
            int deleted = jdbcTemplate.update("DELETE FROM drink_catalog");
            logger.info("Catalog cleared: {} rows removed", deleted);
            return true;
        } catch (DataAccessException e) {
            logger.error("Failed to clear catalog", e);
            return false;
        }
    }

    private int insertInBatches(List<CatalogItem> items) {
        if (items.isEmpty()) {
            return 0;
        }
        Timestamp now = Timestamp.from(clock.instant());
        int inserted = 0;
        for (int from = 0; from < items.size(); from += BATCH_SIZE) {
            List<CatalogItem> chunk = items.subList(from, Math.min(from + BATCH_SIZE, items.size()));
            List<Object[]> batch = chunk.stream()
                    .map(item -> new Object[] {
                            item.id(),
                            item.category().value(),
                            toJson(item),
                            now,
                            now
                    })
                    .toList();
            jdbcTemplate.batchUpdate(INSERT_SQL, batch);
            inserted += chunk.size();
            logger.debug("Inserted batch of {} items ({} of {})", chunk.size(), inserted, items.size());
        }
        return inserted;
    }

    private String toJson(CatalogItem item) {
        try {
            return objectMapper.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize item " + item.id(), e);
        }
    }

    private RowMapper<CatalogItem> itemRowMapper() {
        return (rs, rowNum) -> {
            String data = rs.getString("data");
            try {
                return objectMapper.readValue(data, CatalogItem.class);
            } catch (JsonProcessingException e) {
                logger.warn("Skipping unreadable catalog row {}: {}", rowNum, e.getOriginalMessage());
                return null;
            }
        };
    }

    private List<CatalogItem> withoutUnreadable(List<CatalogItem> items) {
        return items.stream().filter(Objects::nonNull).toList();
    }
}
