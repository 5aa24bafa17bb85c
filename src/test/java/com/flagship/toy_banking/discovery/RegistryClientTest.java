package com.flagship.toy_banking.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.toy_banking.config.BankProperties;
import com.flagship.toy_banking.config.JacksonConfig;
import com.flagship.toy_banking.identity.KeyPairLoader;
import com.flagship.toy_banking.identity.PemKeys;
import com.flagship.toy_banking.protocol.RemoteUnreachableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.security.KeyPair;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RegistryClientTest {

    private static final KeyPair KEYS = KeyPairLoader.generate();

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private final List<ClientRequest> requests = new ArrayList<>();
    private BankProperties.Registry settings;

    @BeforeEach
    void setUp() {
        settings = new BankProperties.Registry();
        settings.setTimeout(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("Resolve maps the registry record to a bank instance")
    void resolvesInstance() {
        RegistryClient client = client(r -> Mono.just(json(HttpStatus.OK, recordJson("BANKBB"))), Optional.empty());

        BankInstance instance = client.resolve("BANKBB");

        assertEquals("BANKBB", instance.getInstanceId());
        assertEquals("Bank BB", instance.getName());
        assertEquals("http://bankbb:8080", instance.getBaseUrl());
        assertEquals("EU", instance.getRegion());
        assertArrayEquals(KEYS.getPublic().getEncoded(), instance.getPublicKey().getEncoded());
        assertEquals(HttpMethod.GET, requests.get(0).method());
        assertEquals("http://registry/banks/BANKBB", requests.get(0).url().toString());
    }

    @Test
    @DisplayName("404 means the instance does not exist")
    void notFound() {
        RegistryClient client = client(r -> Mono.just(json(HttpStatus.NOT_FOUND, "{\"detail\":\"Not found\"}")), Optional.empty());

        InstanceNotFoundException e = assertThrows(InstanceNotFoundException.class, () -> client.resolve("NOBANK"));
        assertEquals("NOBANK", e.getInstanceId());
    }

    @Test
    @DisplayName("Server errors, broken records and silence are unreachable")
    void unreachable() {
        RegistryClient failing = client(r -> Mono.just(json(HttpStatus.INTERNAL_SERVER_ERROR, "{}")), Optional.empty());
        RegistryClient incomplete = client(r -> Mono.just(json(HttpStatus.OK, "{\"swift\":\"BANKBB\"}")), Optional.empty());
        RegistryClient silent = client(r -> Mono.never(), Optional.empty());

        assertThrows(RemoteUnreachableException.class, () -> failing.resolve("BANKBB"));
        assertThrows(RemoteUnreachableException.class, () -> incomplete.resolve("BANKBB"));
        assertThrows(RemoteUnreachableException.class, () -> silent.resolve("BANKBB"));
    }

    @Test
    @DisplayName("A record without a usable public key is unreachable and not cached")
    @SuppressWarnings("unchecked")
    void unusableKey() {
        RedisTemplate<String, String> redis = mock(RedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        RegistryClient noKey = client(r -> Mono.just(json(HttpStatus.OK,
                "{\"swift\":\"BANKBB\",\"bank_metadata\":{\"base_url\":\"http://b\"}}")), Optional.of(redis));
        RegistryClient garbageKey = client(r -> Mono.just(json(HttpStatus.OK,
                "{\"swift\":\"BANKBB\",\"bank_metadata\":{\"base_url\":\"http://b\",\"public_key\":\"not a key\"}}")),
                Optional.empty());

        RemoteUnreachableException e = assertThrows(RemoteUnreachableException.class, () -> noKey.resolve("BANKBB"));
        assertTrue(e.getMessage().contains("public_key"));
        assertThrows(RemoteUnreachableException.class, () -> garbageKey.resolve("BANKBB"));
        verify(ops, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("A cached record is served from Redis without calling the registry")
    @SuppressWarnings("unchecked")
    void cacheHit() {
        RedisTemplate<String, String> redis = mock(RedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.get("registry:bank:BANKBB")).thenReturn(recordJson("BANKBB"));
        RegistryClient client = client(r -> Mono.error(new AssertionError("registry must not be called")), Optional.of(redis));

        BankInstance instance = client.resolve("BANKBB");

        assertEquals("http://bankbb:8080", instance.getBaseUrl());
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("A registry answer is cached with the configured TTL")
    @SuppressWarnings("unchecked")
    void cacheFill() {
        RedisTemplate<String, String> redis = mock(RedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        RegistryClient client = client(r -> Mono.just(json(HttpStatus.OK, recordJson("BANKBB"))), Optional.of(redis));

        client.resolve("BANKBB");

        verify(ops).set(eq("registry:bank:BANKBB"), anyString(), eq(settings.getCacheTtl()));
    }

    @Test
    @DisplayName("Redis failures fall back to the registry")
    @SuppressWarnings("unchecked")
    void redisFailureFallsBack() {
        RedisTemplate<String, String> redis = mock(RedisTemplate.class);
        when(redis.opsForValue()).thenThrow(new RedisConnectionFailureException("redis down"));
        RegistryClient client = client(r -> Mono.just(json(HttpStatus.OK, recordJson("BANKBB"))), Optional.of(redis));

        BankInstance instance = client.resolve("BANKBB");

        assertEquals("BANKBB", instance.getInstanceId());
        assertEquals(1, requests.size());
    }

    @Test
    @DisplayName("Register posts the record; 409 counts as already registered")
    void register() {
        RegistryClient created = client(r -> Mono.just(json(HttpStatus.CREATED, recordJson("BANKAA"))), Optional.empty());
        RegistryClient conflict = client(r -> Mono.just(json(HttpStatus.CONFLICT, "{}")), Optional.empty());
        RegistryClient failing = client(r -> Mono.just(json(HttpStatus.BAD_GATEWAY, "{}")), Optional.empty());
        BankInstance self = BankInstance.builder()
                .instanceId("BANKAA")
                .name("Bank AA")
                .baseUrl("http://bankaa:8080")
                .publicKey(KEYS.getPublic())
                .build();

        assertDoesNotThrow(() -> created.register(self));
        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertEquals("http://registry/banks", requests.get(0).url().toString());
        assertDoesNotThrow(() -> conflict.register(self));
        assertThrows(RemoteUnreachableException.class, () -> failing.register(self));
    }

    @Test
    @DisplayName("Blank instance ids are refused before any call")
    void blankId() {
        RegistryClient client = client(r -> Mono.error(new AssertionError("not called")), Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> client.resolve(" "));
        assertTrue(requests.isEmpty());
    }

    private RegistryClient client(ExchangeFunction exchange, Optional<RedisTemplate<String, String>> redis) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://registry")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return exchange.exchange(request);
                })
                .build();
        return new RegistryClient(webClient, settings, redis, objectMapper);
    }

    private static String recordJson(String swift) {
        String pem = PemKeys.toPem(KEYS.getPublic()).replace("\n", "\\n");
        return "{\"swift\":\"" + swift + "\",\"name\":\"Bank " + swift.substring(4) + "\",\"bank_metadata\":{"
                + "\"base_url\":\"http://" + swift.toLowerCase() + ":8080\","
                + "\"public_key\":\"" + pem + "\","
                + "\"region\":\"EU\",\"country\":\"PT\"}}";
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
