package com.drinkjoy.catalog.infrastructure.adapter;

import com.drinkjoy.catalog.domain.model.SyncMetadata;
import com.drinkjoy.catalog.domain.model.SyncStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisSyncMetadataRepositoryTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private ObjectMapper objectMapper;
    private RedisSyncMetadataRepository repository;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        repository = new RedisSyncMetadataRepository(redisTemplate, objectMapper);
    }

    @Test
    void shouldStoreMetadataAsJsonUnderSourceKey() {
        // Given
        SyncMetadata metadata = SyncMetadata.initial("sheet-1")
                .syncing(Instant.parse("2024-06-01T10:00:00Z"))
                .succeeded(Instant.parse("2024-06-01T10:00:05Z"), Map.of("beer", 4), 4);

        // When
        repository.save(metadata);

        // Then
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("drinkjoy:sync:metadata:sheet-1"), json.capture(), eq(7L), eq(TimeUnit.DAYS));
        assertThat(json.getValue()).contains("\"status\":\"success\"").contains("\"totalItems\":4");
    }

    @Test
    void shouldReadBackStoredMetadata() throws Exception {
        // Given
        SyncMetadata stored = SyncMetadata.initial("sheet-1")
                .failed(Instant.parse("2024-06-01T10:00:00Z"), 2, "no data");
        when(valueOperations.get("drinkjoy:sync:metadata:sheet-1")).thenReturn(objectMapper.writeValueAsString(stored));

        // When
        Optional<SyncMetadata> found = repository.find("sheet-1");

        // Then
        assertThat(found).hasValueSatisfying(m -> {
            assertThat(m.status()).isEqualTo(SyncStatus.ERROR);
            assertThat(m.consecutiveErrors()).isEqualTo(2);
            assertThat(m.lastErrorMessage()).isEqualTo("no data");
        });
    }

    @Test
    void shouldReturnEmptyWhenRedisIsDown() {
        // Given
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        // When & Then
        assertThat(repository.find("sheet-1")).isEmpty();
    }

    @Test
    void shouldNotPropagateWriteFailures() {
        // Given
        doThrow(new RedisConnectionFailureException("refused"))
                .when(valueOperations).set(anyString(), anyString(), anyLong(), any(TimeUnit.class));

        // When & Then
        assertThatCode(() -> repository.save(SyncMetadata.initial("sheet-1"))).doesNotThrowAnyException();
    }
}
