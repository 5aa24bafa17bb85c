package com.flagship.toy_banking.transfer;

import com.flagship.toy_banking.config.BankProperties;
import com.flagship.toy_banking.discovery.BankInstance;
import com.flagship.toy_banking.identity.IdentityService;
import com.flagship.toy_banking.observability.TransferMetrics;
import com.flagship.toy_banking.protocol.MessageRejectedException;
import com.flagship.toy_banking.protocol.MessageType;
import com.flagship.toy_banking.protocol.ParticipantClient;
import com.flagship.toy_banking.protocol.ParticipantState;
import com.flagship.toy_banking.protocol.ProtocolMessage;
import com.flagship.toy_banking.protocol.RemoteUnreachableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends one protocol request to a destination and returns its verified reply.
 *
 * The identical message (same nonce and signature) is resent on RemoteUnreachableException
 * up to {@code bank.protocol.max-attempts} times with a fixed backoff. A reply is accepted
 * only if it answers this very request (its request nonce equals the request's nonce), comes
 * from the destination, names the same transfer, carries a state the request type can
 * produce and verifies against the destination's key. Anything else is treated as not
 * received. MessageRejectedException is final and not retried.
 */
@Component
@Slf4j
public class ParticipantGateway {

    private final ParticipantClient participantClient;
    private final IdentityService identityService;
    private final TransferMetrics metrics;
    private final RetryConfig retryConfig;

    public ParticipantGateway(ParticipantClient participantClient,
                              IdentityService identityService,
                              TransferMetrics metrics,
                              BankProperties properties) {
        this.participantClient = participantClient;
        this.identityService = identityService;
        this.metrics = metrics;
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(properties.getProtocol().getMaxAttempts())
                .waitDuration(properties.getProtocol().getRetryBackoff())
                .retryExceptions(RemoteUnreachableException.class)
                .build();
    }

    /**
     * @throws RemoteUnreachableException if no valid reply arrived within the retry budget
     * @throws MessageRejectedException if the destination refused the envelope
     */
    public ProtocolMessage exchange(BankInstance destination, ProtocolMessage request) {
        String type = request.getType().name();
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = Retry.of(type + "-" + request.getTransferId(), retryConfig);

        try {
            ProtocolMessage reply = Retry.decorateSupplier(retry, () -> {
                int attempt = attempts.incrementAndGet();
                if (attempt > 1) {
                    metrics.recordRetry(type);
                    log.warn("Resending {} to {} (attempt {})", type, destination.getInstanceId(), attempt);
                }
                return verifiedReply(destination, request, participantClient.send(destination.getBaseUrl(), request));
            }).get();
            metrics.recordOutbound(type, reply.getType().name());
            return reply;
        } catch (RemoteUnreachableException e) {
            metrics.recordOutbound(type, "unreachable");
            log.warn("{} to {} got no valid reply after {} attempts: {}",
                    type, destination.getInstanceId(), attempts.get(), e.getMessage());
            throw e;
        } catch (MessageRejectedException e) {
            metrics.recordOutbound(type, "rejected");
            log.warn("{} rejected by {} with status {}: {}",
                    type, destination.getInstanceId(), e.getStatusCode(), e.getMessage());
            throw e;
        }
    }

    private ProtocolMessage verifiedReply(BankInstance destination, ProtocolMessage request, ProtocolMessage reply) {
        if (reply.getType() == null || !reply.getType().isReply()) {
            throw new RemoteUnreachableException("Answer to " + request.getType() + " is not a reply: " + reply.getType());
        }
        if (!destination.getInstanceId().equals(reply.getSenderId())) {
            throw new RemoteUnreachableException("Reply to " + request.getType()
                    + " came from " + reply.getSenderId() + " instead of " + destination.getInstanceId());
        }
        if (!request.getTransferId().equals(reply.getTransferId())) {
            throw new RemoteUnreachableException("Reply to " + request.getType()
                    + " names transfer " + reply.getTransferId());
        }
        if (!request.getNonce().equals(reply.getRequestNonce())) {
            log.warn("Discarding {} from {} that answers another request", reply.getType(), destination.getInstanceId());
            throw new RemoteUnreachableException("Reply to " + request.getType() + " answers request nonce "
                    + reply.getRequestNonce() + " instead of " + request.getNonce());
        }
        if (!answers(request.getType(), reply)) {
            throw new RemoteUnreachableException(reply.getType() + "/" + reply.getState()
                    + " is not an answer to " + request.getType());
        }
        if (!identityService.verify(destination.getPublicKey(), reply.signingPayload(), reply.getSignature())) {
            log.warn("Discarding {} with invalid signature from {}", reply.getType(), destination.getInstanceId());
            throw new RemoteUnreachableException("Reply signature from " + destination.getInstanceId() + " does not verify");
        }
        return reply;
    }

    // NACK may carry any recorded state; ACK states are fixed by the request type
    private static boolean answers(MessageType requestType, ProtocolMessage reply) {
        ParticipantState state = reply.getState();
        if (state == null) {
            return false;
        }
        if (reply.getType() == MessageType.NACK) {
            return true;
        }
        return switch (requestType) {
            case PREPARE -> state == ParticipantState.RESERVED || state == ParticipantState.APPLIED;
            case COMMIT -> state == ParticipantState.APPLIED;
            case ABORT -> state == ParticipantState.RELEASED || state == ParticipantState.REJECTED;
            case QUERY -> true;
            default -> false;
        };
    }
}
