package com.flagship.trade_finance.trade;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps Idempotency-Key headers to action records.
 *
 * Redis is the fast path and may be missing or down; the unique
 * idempotency_key column on action_records is the source of truth.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final ActionRecordRepository recordRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(ActionRecordRepository recordRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.recordRepository = recordRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return id of the action record already holding this key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String recordId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (recordId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(recordId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> recordId = recordRepository.findByIdempotencyKey(idempotencyKey)
                .map(ActionRecordEntity::getId);
        recordId.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return recordId;
    }

    /**
     * Caches the mapping in Redis. The database row already exists by the time
     * this is called.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID recordId) {
        requireKey(idempotencyKey);
        if (recordId == null) {
            throw new IllegalArgumentException("Action record ID cannot be null");
        }
        cache(idempotencyKey, recordId);
    }

    private void cache(String idempotencyKey, UUID recordId) {
        redisTemplate.ifPresent(template -> {
            try {
                template.opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, recordId.toString(), REDIS_TTL);
            } catch (Exception e) {
                log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
            }
        });
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
