package com.flagship.toy_banking.transfer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Client idempotency keys for transfer initiation.
 *
 * Redis is the fast path; the transfers table (unique idempotency_key) is the source of
 * truth. Any Redis failure falls back to the database.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:transfer:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final TransferRepository transferRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(TransferRepository transferRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.transferRepository = transferRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the transfer created earlier with this key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String transferId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (transferId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(transferId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = transferRepository.findByIdempotencyKey(idempotencyKey).map(TransferEntity::getId);
        stored.ifPresent(transferId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, transferId);
        });
        return stored;
    }

    /**
     * Caches the key mapping in Redis. The database row was already written with the transfer.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID transferId) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (transferId == null) {
            throw new IllegalArgumentException("Transfer ID cannot be null");
        }
        cache(idempotencyKey, transferId);
    }

    private void cache(String idempotencyKey, UUID transferId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, transferId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }
}
