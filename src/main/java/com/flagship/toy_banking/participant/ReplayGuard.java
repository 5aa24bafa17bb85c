package com.flagship.toy_banking.participant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.toy_banking.protocol.ProtocolMessage;
import com.flagship.toy_banking.protocol.ReplayedMessageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Remembers every accepted (sender, nonce, transfer id) together with a digest of the
 * message and the signed reply it produced.
 *
 * - Unknown triple: the message is new and gets processed
 * - Same triple, same digest: a retransmission; the original reply is returned and nothing runs again
 * - Same triple, different digest: a replay with altered content, rejected
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReplayGuard {

    private final ProcessedMessageRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Returns the reply sent the first time this exact message was processed.
     *
     * @throws ReplayedMessageException if the triple was used before with different content
     */
    @Transactional
    public Optional<ProtocolMessage> findPreviousReply(ProtocolMessage request) {
        Optional<ProcessedMessageEntity> seen = repository.findBySenderIdAndNonceAndTransferId(
                request.getSenderId(), request.getNonce(), request.getTransferId());
        if (seen.isEmpty()) {
            return Optional.empty();
        }

        ProcessedMessageEntity record = seen.get();
        if (!record.getPayloadDigest().equals(request.payloadDigest())) {
            throw new ReplayedMessageException(String.format(
                    "Nonce %s from %s was already used for transfer %s with different content",
                    request.getNonce(), request.getSenderId(), request.getTransferId()));
        }

        log.debug("Duplicate {} from {}, returning recorded reply", request.getType(), request.getSenderId());
        return Optional.of(deserialize(record.getReply()));
    }

    /**
     * Records a processed message in the caller's transaction, so the record exists
     * exactly when the state change it caused does.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void record(ProtocolMessage request, ProtocolMessage reply) {
        repository.save(ProcessedMessageEntity.of(
                request.getSenderId(),
                request.getNonce(),
                request.getTransferId(),
                request.getType(),
                request.payloadDigest(),
                serialize(reply)));
    }

    @Transactional
    public int purgeProcessedBefore(Instant before) {
        return repository.deleteProcessedBefore(before);
    }

    private String serialize(ProtocolMessage reply) {
        try {
            return objectMapper.writeValueAsString(reply);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize protocol reply", e);
        }
    }

    private ProtocolMessage deserialize(String json) {
        try {
            return objectMapper.readValue(json, ProtocolMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Recorded protocol reply is unreadable", e);
        }
    }
}
