package com.flagship.toy_banking.transfer;

import com.flagship.toy_banking.concurrency.EntityLockRegistry;
import com.flagship.toy_banking.discovery.BankInstance;
import com.flagship.toy_banking.discovery.DiscoveryClient;
import com.flagship.toy_banking.discovery.InstanceNotFoundException;
import com.flagship.toy_banking.identity.IdentityService;
import com.flagship.toy_banking.observability.CorrelationContext;
import com.flagship.toy_banking.observability.TransferMetrics;
import com.flagship.toy_banking.protocol.MessageRejectedException;
import com.flagship.toy_banking.protocol.MessageType;
import com.flagship.toy_banking.protocol.ParticipantState;
import com.flagship.toy_banking.protocol.ProtocolMessage;
import com.flagship.toy_banking.protocol.ProtocolMessageFactory;
import com.flagship.toy_banking.protocol.RemoteUnreachableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Origin side of the two-phase transfer protocol.
 *
 * Local transitions go through {@link TransferSettlementService} while holding the
 * coordinator lock of the transfer; network calls are made without it. Every transition
 * re-reads the transfer, so a cancel or recovery run racing with an in-flight protocol
 * run sees the latest durable status.
 *
 * Outcomes:
 * - PREPARE not acknowledged: ABORTED locally, best-effort ABORT to the destination
 * - COMMIT acknowledged (or any reply reporting APPLIED): COMMITTED
 * - COMMIT unanswered: resolved by QUERY; stays PREPARED while the destination is unreachable
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferCoordinator {

    private final TransferService transferService;
    private final TransferSettlementService settlementService;
    private final TransferPersistenceService persistenceService;
    private final IdempotencyService idempotencyService;
    private final DiscoveryClient discoveryClient;
    private final ParticipantGateway gateway;
    private final ProtocolMessageFactory messageFactory;
    private final IdentityService identityService;
    private final EntityLockRegistry lockRegistry;
    private final TransferMetrics metrics;

    /**
     * Starts a transfer and drives it as far as the protocol allows.
     *
     * A transfer already known by id or idempotency key is returned as is.
     *
     * @throws com.flagship.toy_banking.transfer.exception.TransferValidationException
     *         if the request is malformed
     */
    public InitiationResult initiate(InitiateTransferCommand command) {
        Optional<Transfer> existing = findExisting(command);
        if (existing.isPresent()) {
            log.info("Returning existing transfer {} in status {}", existing.get().getId(), existing.get().getStatus());
            return new InitiationResult(existing.get(), false);
        }

        String localInstanceId = identityService.instanceId();
        transferService.validate(command, localInstanceId);
        Transfer transfer = transferService.createTransfer(command, localInstanceId);

        return CorrelationContext.withTransferId(transfer.getId(), () -> {
            Transfer opened;
            try {
                opened = transition(transfer.getId(),
                        () -> settlementService.open(transfer, command.getIdempotencyKey()));
            } catch (DataIntegrityViolationException e) {
                log.info("Concurrent initiation of transfer {} detected, returning the stored one", transfer.getId());
                Transfer stored = findExisting(command)
                        .orElseThrow(() -> e);
                return new InitiationResult(stored, false);
            }

            metrics.recordTransferInitiated();
            if (command.getIdempotencyKey() != null) {
                idempotencyService.storeIdempotencyKey(command.getIdempotencyKey(), opened.getId());
            }

            Transfer result = opened.isTerminal() ? opened : runProtocol(opened);
            recordOutcome(result);
            return new InitiationResult(result, true);
        });
    }

    /**
     * Cancels a transfer that has not completed.
     *
     * An INITIATED transfer is aborted right away. A PREPARED one goes through QUERY and ABORT,
     * and ends COMMITTED if the destination already applied it.
     *
     * @throws TransferNotFoundException if the transfer does not exist
     */
    public Transfer cancel(UUID transferId) {
        return CorrelationContext.withTransferId(transferId, () -> {
            Transfer transfer = persistenceService.getById(transferId);
            if (transfer.isTerminal()) {
                return transfer;
            }
            log.info("Cancel requested in status {}", transfer.getStatus());

            Transfer result = abortBeforePrepare(transferId, "Canceled by client");
            if (result.getStatus() == TransferStatus.ABORTED) {
                sendAbortBestEffort(transfer.getDestinationId(), transferId);
            } else if (result.getStatus() == TransferStatus.PREPARED) {
                result = resolvePrepared(result);
            }
            recordOutcome(result);
            return result;
        });
    }

    /**
     * Resolves a transfer left non-terminal by an interrupted run.
     * INITIATED transfers are aborted; PREPARED ones are resolved through QUERY.
     */
    public Transfer recover(UUID transferId) {
        return CorrelationContext.withTransferId(transferId, () -> {
            Transfer transfer = persistenceService.getById(transferId);
            if (transfer.isTerminal()) {
                return transfer;
            }

            Transfer result = abortBeforePrepare(transferId, "Recovered after interruption");
            if (result.getStatus() == TransferStatus.ABORTED) {
                sendAbortBestEffort(transfer.getDestinationId(), transferId);
            } else if (result.getStatus() == TransferStatus.PREPARED) {
                result = resolvePrepared(result);
            }
            log.info("Recovery finished in status {}", result.getStatus());
            recordOutcome(result);
            return result;
        });
    }

    private Optional<Transfer> findExisting(InitiateTransferCommand command) {
        if (command.getTransferId() != null) {
            Optional<Transfer> byId = persistenceService.findById(command.getTransferId());
            if (byId.isPresent()) {
                return byId;
            }
        }
        if (command.getIdempotencyKey() != null && !command.getIdempotencyKey().isBlank()) {
            Optional<UUID> previous = idempotencyService.checkIdempotencyKey(command.getIdempotencyKey());
            if (previous.isPresent()) {
                metrics.recordIdempotencyHit();
                return persistenceService.findById(previous.get());
            }
            metrics.recordIdempotencyMiss();
        }
        return Optional.empty();
    }

    private Transfer runProtocol(Transfer transfer) {
        UUID transferId = transfer.getId();

        BankInstance destination;
        try {
            destination = discoveryClient.resolve(transfer.getDestinationId());
        } catch (InstanceNotFoundException e) {
            return abortBeforePrepare(transferId, "Destination instance not found: " + transfer.getDestinationId());
        } catch (RemoteUnreachableException e) {
            return abortBeforePrepare(transferId, "Registry unreachable: " + e.getMessage());
        }

        ProtocolMessage reply;
        try {
            reply = gateway.exchange(destination,
                    messageFactory.prepare(transferId, transfer.getDestinationAccountId(), transfer.getAmount()));
        } catch (RemoteUnreachableException | MessageRejectedException e) {
            Transfer aborted = abortBeforePrepare(transferId, "PREPARE failed: " + e.getMessage());
            sendAbortBestEffort(destination, transferId);
            return aborted;
        }

        if (reply.getState() == ParticipantState.APPLIED) {
            return commit(transferId);
        }
        if (reply.getType() == MessageType.NACK) {
            Transfer aborted = abortBeforePrepare(transferId, "Destination refused: " + reply.getReason());
            sendAbortBestEffort(destination, transferId);
            return aborted;
        }

        Transfer prepared = transition(transferId, () -> settlementService.markPrepared(transferId));
        if (prepared.getStatus() != TransferStatus.PREPARED) {
            // Canceled or recovered while PREPARE was in flight
            return prepared;
        }
        return commitPhase(destination, prepared);
    }

    private Transfer commitPhase(BankInstance destination, Transfer transfer) {
        UUID transferId = transfer.getId();
        ProtocolMessage reply;
        try {
            reply = gateway.exchange(destination, messageFactory.commit(transferId));
        } catch (RemoteUnreachableException | MessageRejectedException e) {
            log.warn("COMMIT outcome unknown, querying destination: {}", e.getMessage());
            return resolveInDoubt(destination, transferId);
        }

        if (reply.getState() == ParticipantState.APPLIED) {
            return commit(transferId);
        }
        if (reply.getType() == MessageType.NACK) {
            return abort(transferId, "Destination refused commit: " + reply.getReason());
        }
        return resolveInDoubt(destination, transferId);
    }

    private Transfer resolvePrepared(Transfer transfer) {
        BankInstance destination;
        try {
            destination = discoveryClient.resolve(transfer.getDestinationId());
        } catch (InstanceNotFoundException | RemoteUnreachableException e) {
            log.warn("Cannot resolve destination {} of prepared transfer, leaving it in doubt: {}",
                    transfer.getDestinationId(), e.getMessage());
            return transfer;
        }
        return resolveInDoubt(destination, transfer.getId());
    }

    /**
     * Asks the destination for its state and settles accordingly. The transfer stays
     * PREPARED, with the debit hold kept, while the destination cannot be reached.
     */
    private Transfer resolveInDoubt(BankInstance destination, UUID transferId) {
        ProtocolMessage reply;
        try {
            reply = gateway.exchange(destination, messageFactory.query(transferId));
        } catch (RemoteUnreachableException | MessageRejectedException e) {
            log.warn("Transfer in doubt, destination {} did not answer QUERY: {}",
                    destination.getInstanceId(), e.getMessage());
            return persistenceService.getById(transferId);
        }

        ParticipantState state = reply.getState() != null ? reply.getState() : ParticipantState.NONE;
        switch (state) {
            case APPLIED:
                return commit(transferId);
            case RESERVED:
            case NONE:
                return abortAtDestination(destination, transferId, state);
            default:
                return abort(transferId, "Destination reports " + state);
        }
    }

    private Transfer abortAtDestination(BankInstance destination, UUID transferId, ParticipantState observed) {
        ProtocolMessage reply;
        try {
            reply = gateway.exchange(destination, messageFactory.abort(transferId));
        } catch (RemoteUnreachableException | MessageRejectedException e) {
            log.warn("ABORT not acknowledged by {}, transfer stays in doubt: {}",
                    destination.getInstanceId(), e.getMessage());
            return persistenceService.getById(transferId);
        }

        if (reply.getState() == ParticipantState.APPLIED) {
            return commit(transferId);
        }
        if (reply.getType() == MessageType.ACK
                && (reply.getState() == ParticipantState.RELEASED || reply.getState() == ParticipantState.REJECTED)) {
            return abort(transferId, "Aborted at destination (was " + observed + ")");
        }
        log.warn("Unexpected reply to ABORT: {} {}", reply.getType(), reply.getState());
        return persistenceService.getById(transferId);
    }

    private Transfer commit(UUID transferId) {
        try {
            return transition(transferId, () -> settlementService.commit(transferId));
        } catch (IllegalStateException e) {
            log.error("Destination applied a transfer this instance already aborted: {}", e.getMessage());
            return persistenceService.getById(transferId);
        }
    }

    private Transfer abort(UUID transferId, String reason) {
        return transition(transferId, () -> settlementService.abort(transferId, reason));
    }

    /**
     * Aborts only while nothing was prepared; a PREPARED transfer is returned unchanged.
     */
    private Transfer abortBeforePrepare(UUID transferId, String reason) {
        return transition(transferId, () -> {
            Transfer current = persistenceService.getById(transferId);
            if (current.getStatus() != TransferStatus.INITIATED) {
                return current;
            }
            return settlementService.abort(transferId, reason);
        });
    }

    private void sendAbortBestEffort(String destinationId, UUID transferId) {
        try {
            sendAbortBestEffort(discoveryClient.resolve(destinationId), transferId);
        } catch (InstanceNotFoundException | RemoteUnreachableException e) {
            log.info("Skipping ABORT to {}: {}", destinationId, e.getMessage());
        }
    }

    private void sendAbortBestEffort(BankInstance destination, UUID transferId) {
        try {
            gateway.exchange(destination, messageFactory.abort(transferId));
        } catch (RemoteUnreachableException | MessageRejectedException e) {
            log.info("Best-effort ABORT to {} failed, its reservation will expire: {}",
                    destination.getInstanceId(), e.getMessage());
        }
    }

    private Transfer transition(UUID transferId, Supplier<Transfer> action) {
        return lockRegistry.withLock(EntityLockRegistry.coordinatorKey(transferId), action);
    }

    private void recordOutcome(Transfer transfer) {
        if (transfer.isTerminal()) {
            metrics.recordTransferCompleted(transfer.getStatus().name());
            metrics.recordTransferDuration(Duration.between(transfer.getCreatedAt(), Instant.now()));
            log.info("Transfer finished: status={}, reason={}", transfer.getStatus(), transfer.getFailureReason());
        } else {
            log.info("Transfer left in status {}", transfer.getStatus());
        }
    }
}
