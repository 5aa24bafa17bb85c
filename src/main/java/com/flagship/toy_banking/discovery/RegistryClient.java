package com.flagship.toy_banking.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.toy_banking.config.BankProperties;
import com.flagship.toy_banking.discovery.dto.BankRecord;
import com.flagship.toy_banking.identity.PemKeys;
import com.flagship.toy_banking.protocol.RemoteUnreachableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.security.PublicKey;
import java.util.Optional;

/**
 * WebClient-based DiscoveryClient backed by the bank registry.
 *
 * Resolved records are cached in Redis for {@code bank.registry.cache-ttl}. Redis is only a
 * fast path: any Redis failure falls back to the registry, which stays the source of truth.
 *
 * Not a Spring @Component; registered in {@link com.flagship.toy_banking.config.ClientConfig}.
 */
@Slf4j
public class RegistryClient implements DiscoveryClient {

    private static final String CACHE_KEY_PREFIX = "registry:bank:";

    private final WebClient webClient;
    private final BankProperties.Registry settings;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final ObjectMapper objectMapper;

    public RegistryClient(WebClient webClient,
                          BankProperties.Registry settings,
                          Optional<RedisTemplate<String, String>> redisTemplate,
                          ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.settings = settings;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public BankInstance resolve(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("Instance id cannot be null or blank");
        }

        Optional<BankRecord> cached = readCache(instanceId);
        if (cached.isPresent()) {
            return toInstance(cached.get());
        }

        BankRecord record = fetch(instanceId);
        BankInstance instance = toInstance(record);
        writeCache(instanceId, record);
        return instance;
    }

    @Override
    public void register(BankInstance instance) {
        BankRecord record = BankRecord.builder()
                .swift(instance.getInstanceId())
                .name(instance.getName())
                .bankMetadata(BankRecord.Metadata.builder()
                        .baseUrl(instance.getBaseUrl())
                        .publicKey(PemKeys.toPem(instance.getPublicKey()))
                        .region(instance.getRegion())
                        .country(instance.getCountry())
                        .build())
                .build();

        log.debug("Calling register: swift={}", record.getSwift());
        try {
            webClient.post()
                    .uri("/banks")
                    .bodyValue(record)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(settings.getTimeout())
                    .block();
            log.info("Registered instance {} at {}", record.getSwift(), instance.getBaseUrl());
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                log.info("Instance {} is already registered", record.getSwift());
                return;
            }
            throw new RemoteUnreachableException(
                    "Registry refused registration of " + record.getSwift() + ": " + e.getStatusCode(), e);
        } catch (RuntimeException e) {
            throw new RemoteUnreachableException("Registry unreachable: " + e.getMessage(), e);
        }
    }

    private BankRecord fetch(String instanceId) {
        log.debug("Calling resolve: swift={}", instanceId);
        BankRecord record;
        try {
            record = webClient.get()
                    .uri("/banks/{swift}", instanceId)
                    .retrieve()
                    .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(),
                            response -> Mono.error(new InstanceNotFoundException(instanceId)))
                    .bodyToMono(BankRecord.class)
                    .timeout(settings.getTimeout())
                    .block();
        } catch (InstanceNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RemoteUnreachableException("Registry unreachable while resolving " + instanceId, e);
        }

        if (record == null || record.getBankMetadata() == null) {
            throw new RemoteUnreachableException("Registry returned an incomplete record for " + instanceId);
        }
        return record;
    }

    /**
     * A record without a base URL or a readable public key cannot be used to talk to the
     * instance; it is reported like an unreachable registry so callers abort the same way.
     */
    private BankInstance toInstance(BankRecord record) {
        BankRecord.Metadata metadata = record.getBankMetadata();
        if (metadata.getBaseUrl() == null || metadata.getBaseUrl().isBlank()) {
            throw new RemoteUnreachableException("Registry record of " + record.getSwift() + " has no base_url");
        }
        PublicKey publicKey;
        try {
            publicKey = PemKeys.readPublicKey(metadata.getPublicKey());
        } catch (IllegalArgumentException e) {
            throw new RemoteUnreachableException("Registry record of " + record.getSwift()
                    + " has an unusable public_key: " + e.getMessage(), e);
        }
        return BankInstance.builder()
                .instanceId(record.getSwift())
                .name(record.getName())
                .baseUrl(metadata.getBaseUrl())
                .publicKey(publicKey)
                .region(metadata.getRegion())
                .country(metadata.getCountry())
                .build();
    }

    private Optional<BankRecord> readCache(String instanceId) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.get().opsForValue().get(CACHE_KEY_PREFIX + instanceId);
            if (json != null) {
                log.debug("Registry record found in Redis: {}", instanceId);
                return Optional.of(objectMapper.readValue(json, BankRecord.class));
            }
        } catch (Exception e) {
            log.warn("Redis lookup failed for instance {}. Falling back to registry. Error: {}",
                    instanceId, e.getMessage());
        }
        return Optional.empty();
    }

    private void writeCache(String instanceId, BankRecord record) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(record);
            redisTemplate.get().opsForValue().set(CACHE_KEY_PREFIX + instanceId, json, settings.getCacheTtl());
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize registry record for {}: {}", instanceId, e.getMessage());
        } catch (Exception e) {
            log.debug("Failed to cache registry record in Redis: {}", e.getMessage());
        }
    }
}
