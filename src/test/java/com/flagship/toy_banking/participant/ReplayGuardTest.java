package com.flagship.toy_banking.participant;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.toy_banking.config.JacksonConfig;
import com.flagship.toy_banking.discovery.DiscoveryClient;
import com.flagship.toy_banking.identity.IdentityService;
import com.flagship.toy_banking.identity.KeyPairLoader;
import com.flagship.toy_banking.identity.LocalIdentity;
import com.flagship.toy_banking.protocol.ParticipantState;
import com.flagship.toy_banking.protocol.ProtocolMessage;
import com.flagship.toy_banking.protocol.ProtocolMessageFactory;
import com.flagship.toy_banking.protocol.ReplayedMessageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReplayGuardTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private ProcessedMessageRepository repository;
    private ProtocolMessageFactory factory;
    private ReplayGuard replayGuard;

    @BeforeEach
    void setUp() {
        repository = mock(ProcessedMessageRepository.class);
        factory = new ProtocolMessageFactory(
                new IdentityService(new LocalIdentity("BANKAA", KeyPairLoader.generate()), mock(DiscoveryClient.class)));
        replayGuard = new ReplayGuard(repository, objectMapper);
    }

    @Test
    @DisplayName("Unseen message is new")
    void unseenMessage() {
        ProtocolMessage commit = factory.commit(UUID.randomUUID());

        assertTrue(replayGuard.findPreviousReply(commit).isEmpty());
    }

    @Test
    @DisplayName("Retransmission gets the recorded reply back")
    void retransmission() {
        ProtocolMessage commit = factory.commit(UUID.randomUUID());
        ProtocolMessage reply = factory.ack(commit, ParticipantState.APPLIED);
        ProcessedMessageEntity recorded = recordAndCapture(commit, reply);
        when(repository.findBySenderIdAndNonceAndTransferId("BANKAA", commit.getNonce(), commit.getTransferId()))
                .thenReturn(Optional.of(recorded));

        Optional<ProtocolMessage> previous = replayGuard.findPreviousReply(commit);

        assertTrue(previous.isPresent());
        assertEquals(reply, previous.get());
    }

    @Test
    @DisplayName("Same nonce with different content is a replay")
    void alteredReplay() {
        ProtocolMessage prepare = factory.prepare(UUID.randomUUID(), UUID.randomUUID(), 500);
        ProcessedMessageEntity recorded = recordAndCapture(prepare, factory.ack(prepare, ParticipantState.RESERVED));
        ProtocolMessage altered = prepare.toBuilder().amount(900L).build();
        when(repository.findBySenderIdAndNonceAndTransferId("BANKAA", prepare.getNonce(), prepare.getTransferId()))
                .thenReturn(Optional.of(recorded));

        assertThrows(ReplayedMessageException.class, () -> replayGuard.findPreviousReply(altered));
    }

    @Test
    @DisplayName("Recorded row carries the triple, type and digest")
    void recordedRow() {
        ProtocolMessage abort = factory.abort(UUID.randomUUID());

        ProcessedMessageEntity row = recordAndCapture(abort, factory.ack(abort, ParticipantState.RELEASED));

        assertEquals("BANKAA", row.getSenderId());
        assertEquals(abort.getNonce(), row.getNonce());
        assertEquals(abort.getTransferId(), row.getTransferId());
        assertEquals(abort.getType(), row.getMessageType());
        assertEquals(abort.payloadDigest(), row.getPayloadDigest());
        assertTrue(row.getReply().contains("\"state\":\"RELEASED\""));
    }

    private ProcessedMessageEntity recordAndCapture(ProtocolMessage request, ProtocolMessage reply) {
        replayGuard.record(request, reply);
        ArgumentCaptor<ProcessedMessageEntity> captor = ArgumentCaptor.forClass(ProcessedMessageEntity.class);
        verify(repository).save(captor.capture());
        return captor.getValue();
    }
}
