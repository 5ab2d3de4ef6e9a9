package com.drinkjoy.catalog.infrastructure.adapter;

import com.drinkjoy.catalog.domain.model.SyncMetadata;
import com.drinkjoy.catalog.domain.port.out.SyncMetadataRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Sync bookkeeping kept in Redis as one JSON document per source id
 */
@Repository
public class RedisSyncMetadataRepository implements SyncMetadataRepository {

    private static final Logger logger = LoggerFactory.getLogger(RedisSyncMetadataRepository.class);

    private static final String METADATA_KEY_PREFIX = "drinkjoy:sync:metadata:";
    private static final long METADATA_TTL_DAYS = 7;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisSyncMetadataRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<SyncMetadata> find(String sourceId) {
        try {
            String json = redisTemplate.opsForValue().get(keyFor(sourceId));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, SyncMetadata.class));
        } catch (Exception e) {
            logger.error("Failed to read sync metadata for source {}", sourceId, e);
            return Optional.empty();
        }
    }

    @Override
    public void save(SyncMetadata metadata) {
        try {
            String json = objectMapper.writeValueAsString(metadata);
            redisTemplate.opsForValue().set(keyFor(metadata.sourceId()), json, METADATA_TTL_DAYS, TimeUnit.DAYS);
            logger.debug("Updated sync metadata for source {}: {}", metadata.sourceId(), metadata.status());
        } catch (Exception e) {
            logger.error("Failed to update sync metadata for source {}", metadata.sourceId(), e);
        }
    }

    private String keyFor(String sourceId) {
        return METADATA_KEY_PREFIX + sourceId;
    }
}
