package com.flagship.toy_banking.identity;

import com.flagship.toy_banking.discovery.BankInstance;
import com.flagship.toy_banking.discovery.DiscoveryClient;
import com.flagship.toy_banking.discovery.InstanceNotFoundException;
import com.flagship.toy_banking.protocol.RemoteUnreachableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IdentityServiceTest {

    private static final KeyPair LOCAL_KEYS = KeyPairLoader.generate();
    private static final KeyPair OTHER_KEYS = KeyPairLoader.generate();
    private static final byte[] PAYLOAD = "PREPARE|BANKXX|500".getBytes(StandardCharsets.UTF_8);

    private DiscoveryClient discoveryClient;
    private IdentityService identityService;

    @BeforeEach
    void setUp() {
        discoveryClient = mock(DiscoveryClient.class);
        identityService = new IdentityService(new LocalIdentity("BANKAA", LOCAL_KEYS), discoveryClient);
    }

    @Test
    @DisplayName("A signature verifies against the signer's registry key")
    void signAndVerify() {
        when(discoveryClient.resolve("BANKAA")).thenReturn(instance("BANKAA", LOCAL_KEYS));

        String signature = identityService.sign(PAYLOAD);

        assertTrue(identityService.verify("BANKAA", PAYLOAD, signature));
    }

    @Test
    @DisplayName("Altered payload, wrong key and malformed signatures do not verify")
    void rejectsBadSignatures() {
        when(discoveryClient.resolve("BANKAA")).thenReturn(instance("BANKAA", LOCAL_KEYS));
        when(discoveryClient.resolve("BANKBB")).thenReturn(instance("BANKBB", OTHER_KEYS));
        String signature = identityService.sign(PAYLOAD);

        assertFalse(identityService.verify("BANKAA", "PREPARE|BANKXX|900".getBytes(StandardCharsets.UTF_8), signature));
        assertFalse(identityService.verify("BANKBB", PAYLOAD, signature));
        assertFalse(identityService.verify("BANKAA", PAYLOAD, "not-base64!"));
        assertFalse(identityService.verify("BANKAA", PAYLOAD, "AAAA"));
        assertFalse(identityService.verify("BANKAA", PAYLOAD, null));
        assertFalse(identityService.verify(" ", PAYLOAD, signature));
    }

    @Test
    @DisplayName("Unknown sender is a failed verification")
    void unknownSender() {
        when(discoveryClient.resolve("NOBANK")).thenThrow(new InstanceNotFoundException("NOBANK"));

        assertFalse(identityService.verify("NOBANK", PAYLOAD, identityService.sign(PAYLOAD)));
    }

    @Test
    @DisplayName("Registry outage propagates instead of failing verification")
    void registryOutagePropagates() {
        when(discoveryClient.resolve("BANKAA")).thenThrow(new RemoteUnreachableException("registry down"));
        String signature = identityService.sign(PAYLOAD);

        assertThrows(RemoteUnreachableException.class, () -> identityService.verify("BANKAA", PAYLOAD, signature));
    }

    private static BankInstance instance(String id, KeyPair keys) {
        return BankInstance.builder()
                .instanceId(id)
                .baseUrl("http://" + id.toLowerCase() + ":8080")
                .publicKey(keys.getPublic())
                .build();
    }
}
