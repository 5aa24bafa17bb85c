package com.flagship.toy_banking.participant;

import com.flagship.toy_banking.concurrency.EntityLockRegistry;
import com.flagship.toy_banking.identity.IdentityService;
import com.flagship.toy_banking.ledger.LedgerUnavailableException;
import com.flagship.toy_banking.observability.CorrelationContext;
import com.flagship.toy_banking.observability.TransferMetrics;
import com.flagship.toy_banking.protocol.ProtocolMessage;
import com.flagship.toy_banking.protocol.ReplayedMessageException;
import com.flagship.toy_banking.protocol.SignatureVerificationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Entry point for inbound protocol messages on the destination side.
 *
 * Order of checks:
 * 1. Envelope shape (400 on malformed input)
 * 2. Signature against the sender's registry key (hard reject, no state touched)
 * 3. Replay guard and dispatch, under the participant lock for the transfer id
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferParticipant {

    private final IdentityService identityService;
    private final ParticipantDecisionService decisionService;
    private final EntityLockRegistry lockRegistry;
    private final TransferMetrics metrics;

    /**
     * @throws IllegalArgumentException if the envelope is malformed or is itself a reply
     * @throws SignatureVerificationException if the signature does not verify
     * @throws ReplayedMessageException if the nonce was used before with different content
     * @throws LedgerUnavailableException if the database cannot be reached
     */
    public ProtocolMessage handle(ProtocolMessage request) {
        validateEnvelope(request);

        return CorrelationContext.withTransferId(request.getTransferId(), () -> {
            if (!identityService.verify(request.getSenderId(), request.signingPayload(), request.getSignature())) {
                metrics.recordRejected("signature");
                log.warn("Rejected {} with invalid signature: sender={}, nonce={}",
                        request.getType(), request.getSenderId(), request.getNonce());
                throw new SignatureVerificationException(
                        "Signature of " + request.getType() + " from " + request.getSenderId() + " does not verify");
            }

            try {
                return lockRegistry.withLock(EntityLockRegistry.participantKey(request.getTransferId()),
                        () -> decisionService.decide(request));
            } catch (ReplayedMessageException e) {
                metrics.recordRejected("replay");
                log.warn("Rejected replayed {}: sender={}, nonce={}: {}",
                        request.getType(), request.getSenderId(), request.getNonce(), e.getMessage());
                throw e;
            } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
                log.error("Ledger unavailable while handling {}: {}", request.getType(), e.getMessage());
                throw new LedgerUnavailableException("Ledger unavailable", e);
            }
        });
    }

    private void validateEnvelope(ProtocolMessage request) {
        if (request == null || request.getType() == null || request.getTransferId() == null) {
            throw new IllegalArgumentException("Message type and transfer_id are required");
        }
        if (isBlank(request.getSenderId()) || isBlank(request.getNonce()) || isBlank(request.getSignature())) {
            throw new IllegalArgumentException("sender_id, nonce and signature are required");
        }
        if (request.getType().isReply()) {
            throw new IllegalArgumentException(request.getType() + " is a reply and cannot be handled as a request");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
