package com.flagship.toy_banking.participant;

import com.flagship.toy_banking.concurrency.EntityLockRegistry;
import com.flagship.toy_banking.discovery.BankInstance;
import com.flagship.toy_banking.discovery.DiscoveryClient;
import com.flagship.toy_banking.identity.IdentityService;
import com.flagship.toy_banking.identity.KeyPairLoader;
import com.flagship.toy_banking.identity.LocalIdentity;
import com.flagship.toy_banking.ledger.LedgerUnavailableException;
import com.flagship.toy_banking.observability.TransferMetrics;
import com.flagship.toy_banking.protocol.ParticipantState;
import com.flagship.toy_banking.protocol.ProtocolMessage;
import com.flagship.toy_banking.protocol.ProtocolMessageFactory;
import com.flagship.toy_banking.protocol.ReplayedMessageException;
import com.flagship.toy_banking.protocol.SignatureVerificationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.security.KeyPair;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TransferParticipantTest {

    private static final KeyPair ORIGIN_KEYS = KeyPairLoader.generate();
    private static final KeyPair DESTINATION_KEYS = KeyPairLoader.generate();

    private ParticipantDecisionService decisionService;
    private SimpleMeterRegistry meterRegistry;
    private ProtocolMessageFactory originFactory;
    private ProtocolMessageFactory destinationFactory;
    private TransferParticipant participant;

    @BeforeEach
    void setUp() {
        DiscoveryClient discoveryClient = mock(DiscoveryClient.class);
        when(discoveryClient.resolve("BANKAA")).thenReturn(BankInstance.builder()
                .instanceId("BANKAA")
                .baseUrl("http://bankaa:8080")
                .publicKey(ORIGIN_KEYS.getPublic())
                .build());

        originFactory = new ProtocolMessageFactory(
                new IdentityService(new LocalIdentity("BANKAA", ORIGIN_KEYS), discoveryClient));
        IdentityService destinationIdentity =
                new IdentityService(new LocalIdentity("BANKBB", DESTINATION_KEYS), discoveryClient);
        destinationFactory = new ProtocolMessageFactory(destinationIdentity);

        decisionService = mock(ParticipantDecisionService.class);
        meterRegistry = new SimpleMeterRegistry();
        participant = new TransferParticipant(destinationIdentity, decisionService,
                new EntityLockRegistry(), new TransferMetrics(meterRegistry));
    }

    @Test
    @DisplayName("Signed request is handed to the decision service")
    void validRequestIsDecided() {
        ProtocolMessage prepare = originFactory.prepare(UUID.randomUUID(), UUID.randomUUID(), 500);
        ProtocolMessage reply = destinationFactory.ack(prepare, ParticipantState.RESERVED);
        when(decisionService.decide(prepare)).thenReturn(reply);

        assertSame(reply, participant.handle(prepare));
    }

    @Test
    @DisplayName("Altered request is rejected before any state is touched")
    void invalidSignature() {
        ProtocolMessage prepare = originFactory.prepare(UUID.randomUUID(), UUID.randomUUID(), 500);
        ProtocolMessage forged = prepare.toBuilder().amount(50_000L).build();

        assertThrows(SignatureVerificationException.class, () -> participant.handle(forged));
        verify(decisionService, never()).decide(any());
        assertEquals(1.0, meterRegistry.counter("protocol.rejected", "reason", "signature").count());
    }

    @Test
    @DisplayName("Request signed by another key is rejected")
    void wrongKey() {
        ProtocolMessage impostor = new ProtocolMessageFactory(
                new IdentityService(new LocalIdentity("BANKAA", KeyPairLoader.generate()), mock(DiscoveryClient.class)))
                .commit(UUID.randomUUID());

        assertThrows(SignatureVerificationException.class, () -> participant.handle(impostor));
        verify(decisionService, never()).decide(any());
    }

    @Test
    @DisplayName("Malformed envelopes are refused")
    void malformedEnvelope() {
        ProtocolMessage commit = originFactory.commit(UUID.randomUUID());

        assertThrows(IllegalArgumentException.class, () -> participant.handle(null));
        assertThrows(IllegalArgumentException.class,
                () -> participant.handle(commit.toBuilder().transferId(null).build()));
        assertThrows(IllegalArgumentException.class,
                () -> participant.handle(commit.toBuilder().nonce(" ").build()));
        assertThrows(IllegalArgumentException.class,
                () -> participant.handle(commit.toBuilder().signature(null).build()));
        assertThrows(IllegalArgumentException.class,
                () -> participant.handle(originFactory.ack(commit, ParticipantState.APPLIED)));
        verify(decisionService, never()).decide(any());
    }

    @Test
    @DisplayName("Replay is counted and propagated")
    void replayIsCounted() {
        ProtocolMessage commit = originFactory.commit(UUID.randomUUID());
        when(decisionService.decide(commit)).thenThrow(new ReplayedMessageException("nonce reused"));

        assertThrows(ReplayedMessageException.class, () -> participant.handle(commit));
        assertEquals(1.0, meterRegistry.counter("protocol.rejected", "reason", "replay").count());
    }

    @Test
    @DisplayName("Database outage surfaces as ledger unavailable")
    void databaseDown() {
        ProtocolMessage query = originFactory.query(UUID.randomUUID());
        when(decisionService.decide(query)).thenThrow(new DataAccessResourceFailureException("connection refused"));

        LedgerUnavailableException e = assertThrows(LedgerUnavailableException.class, () -> participant.handle(query));
        assertInstanceOf(DataAccessResourceFailureException.class, e.getCause());
    }
}
