package com.flagship.toy_banking.participant;

import com.flagship.toy_banking.config.BankProperties;
import com.flagship.toy_banking.ledger.Account;
import com.flagship.toy_banking.ledger.LedgerService;
import com.flagship.toy_banking.ledger.ReservationDirection;
import com.flagship.toy_banking.observability.TransferMetrics;
import com.flagship.toy_banking.outbox.OutboxService;
import com.flagship.toy_banking.protocol.ParticipantState;
import com.flagship.toy_banking.protocol.ProtocolMessage;
import com.flagship.toy_banking.protocol.ProtocolMessageFactory;
import com.flagship.toy_banking.transfer.event.InboundTransferAppliedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Destination-side decisions for one verified protocol message.
 *
 * Each call runs in a single database transaction covering the participant record, the
 * ledger change, the outbox event and the replay record. Callers hold the per-transfer
 * participant lock around it, so one transfer id is decided by one thread at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParticipantDecisionService {

    static final String AGGREGATE_TYPE = "ParticipantTransfer";

    private final ParticipantTransferRepository repository;
    private final LedgerService ledgerService;
    private final ReplayGuard replayGuard;
    private final ProtocolMessageFactory messageFactory;
    private final OutboxService outboxService;
    private final TransferMetrics metrics;
    private final BankProperties properties;

    /**
     * Processes a request and returns the signed reply.
     * A retransmitted message gets its original reply back without running again.
     */
    @Transactional
    public ProtocolMessage decide(ProtocolMessage request) {
        Optional<ProtocolMessage> previous = replayGuard.findPreviousReply(request);
        if (previous.isPresent()) {
            metrics.recordInbound(request.getType().name(), "duplicate");
            return previous.get();
        }

        ProtocolMessage reply = switch (request.getType()) {
            case PREPARE -> prepare(request);
            case COMMIT -> commit(request);
            case ABORT -> abort(request);
            case QUERY -> query(request);
            case ACK, NACK -> throw new IllegalArgumentException("Replies cannot be sent to a participant");
        };

        replayGuard.record(request, reply);
        metrics.recordInbound(request.getType().name(), reply.getType().name());
        return reply;
    }

    /**
     * Releases a reservation whose deadline passed without a commit.
     *
     * @return true if the reservation was released by this call
     */
    @Transactional
    public boolean expire(UUID transferId, Instant now) {
        Optional<ParticipantTransferEntity> found = repository.findById(transferId);
        if (found.isEmpty()) {
            return false;
        }
        ParticipantTransfer transfer = found.get().toDomain();
        if (transfer.getState() != ParticipantState.RESERVED || !transfer.isExpired(now)) {
            return false;
        }
        releaseExpired(found.get(), transfer);
        return true;
    }

    private ProtocolMessage prepare(ProtocolMessage request) {
        UUID transferId = request.getTransferId();
        if (request.getAccountId() == null || request.getAmount() == null) {
            throw new IllegalArgumentException("PREPARE requires account_id and amount");
        }

        Optional<ParticipantTransferEntity> existing = repository.findById(transferId);
        if (existing.isPresent()) {
            ParticipantTransfer recorded = existing.get().toDomain();
            if (!recorded.matches(request.getSenderId(), request.getAccountId(), request.getAmount())) {
                log.warn("Conflicting PREPARE for transfer {} from {}, recorded state {}",
                        transferId, request.getSenderId(), recorded.getState());
                return messageFactory.nack(request, recorded.getState(), "Conflicting prepare for transfer");
            }
            log.info("PREPARE for known transfer {}, repeating decision {}", transferId, recorded.getState());
            return replyFor(request, recorded);
        }

        String refusal = validatePrepare(request);
        if (refusal != null) {
            ParticipantTransfer rejected = ParticipantTransfer.rejected(
                    transferId, request.getSenderId(), request.getAccountId(), request.getAmount(), refusal);
            repository.save(ParticipantTransferEntity.fromDomain(rejected));
            log.info("PREPARE for transfer {} rejected: {}", transferId, refusal);
            return messageFactory.nack(request, ParticipantState.REJECTED, refusal);
        }

        Instant expiresAt = Instant.now().plus(properties.getProtocol().getReservationTtl());
        ledgerService.reserveCredit(transferId, request.getAccountId(), request.getAmount(), expiresAt);
        ParticipantTransfer reserved = ParticipantTransfer.reserved(
                transferId, request.getSenderId(), request.getAccountId(), request.getAmount(), expiresAt);
        repository.save(ParticipantTransferEntity.fromDomain(reserved));

        log.info("Reserved inbound transfer {}: account={}, amount={}, expiresAt={}",
                transferId, request.getAccountId(), request.getAmount(), expiresAt);
        return messageFactory.ack(request, ParticipantState.RESERVED);
    }

    private ProtocolMessage commit(ProtocolMessage request) {
        Optional<ParticipantTransferEntity> found = repository.findById(request.getTransferId());
        if (found.isEmpty()) {
            return messageFactory.nack(request, ParticipantState.NONE, "No reservation for transfer");
        }

        ParticipantTransferEntity entity = found.get();
        ParticipantTransfer transfer = entity.toDomain();
        if (!transfer.getOriginId().equals(request.getSenderId())) {
            log.warn("COMMIT for transfer {} from {} refused, origin is {}",
                    transfer.getTransferId(), request.getSenderId(), transfer.getOriginId());
            return messageFactory.nack(request, transfer.getState(), "Sender is not the origin of the transfer");
        }

        switch (transfer.getState()) {
            case APPLIED:
                return messageFactory.ack(request, ParticipantState.APPLIED);
            case RESERVED:
                if (transfer.isExpired(Instant.now())) {
                    releaseExpired(entity, transfer);
                    return messageFactory.nack(request, ParticipantState.RELEASED, "Reservation expired");
                }
                ledgerService.apply(transfer.getTransferId(), ReservationDirection.CREDIT);
                ParticipantTransfer applied = transfer.apply();
                entity.updateFromDomain(applied);
                repository.save(entity);
                outboxService.saveEvent(AGGREGATE_TYPE, transfer.getTransferId(),
                        InboundTransferAppliedEvent.EVENT_TYPE,
                        InboundTransferAppliedEvent.of(transfer.getTransferId(), transfer.getOriginId(),
                                transfer.getAccountId(), transfer.getAmount()));
                log.info("Applied inbound transfer {}: account={}, amount={}",
                        transfer.getTransferId(), transfer.getAccountId(), transfer.getAmount());
                return messageFactory.ack(request, ParticipantState.APPLIED);
            default:
                return messageFactory.nack(request, transfer.getState(),
                        "Cannot commit transfer in " + transfer.getState() + " state");
        }
    }

    private ProtocolMessage abort(ProtocolMessage request) {
        Optional<ParticipantTransferEntity> found = repository.findById(request.getTransferId());
        if (found.isEmpty()) {
            ParticipantTransfer tombstone = ParticipantTransfer.tombstone(request.getTransferId(), request.getSenderId());
            repository.save(ParticipantTransferEntity.fromDomain(tombstone));
            log.info("ABORT before PREPARE for transfer {}, tombstone recorded", request.getTransferId());
            return messageFactory.ack(request, ParticipantState.RELEASED);
        }

        ParticipantTransferEntity entity = found.get();
        ParticipantTransfer transfer = entity.toDomain();
        if (!transfer.getOriginId().equals(request.getSenderId())) {
            return messageFactory.nack(request, transfer.getState(), "Sender is not the origin of the transfer");
        }

        switch (transfer.getState()) {
            case RESERVED:
                ledgerService.release(transfer.getTransferId(), ReservationDirection.CREDIT);
                ParticipantTransfer released = transfer.release("Aborted by origin");
                entity.updateFromDomain(released);
                repository.save(entity);
                log.info("Released inbound transfer {} on ABORT", transfer.getTransferId());
                return messageFactory.ack(request, ParticipantState.RELEASED);
            case APPLIED:
                return messageFactory.nack(request, ParticipantState.APPLIED, "Transfer already applied");
            default:
                return messageFactory.ack(request, transfer.getState());
        }
    }

    private ProtocolMessage query(ProtocolMessage request) {
        Optional<ParticipantTransfer> found = repository.findById(request.getTransferId())
                .map(ParticipantTransferEntity::toDomain);
        if (found.isEmpty()) {
            return messageFactory.ack(request, ParticipantState.NONE);
        }
        ParticipantTransfer transfer = found.get();
        if (!transfer.getOriginId().equals(request.getSenderId())) {
            return messageFactory.nack(request, ParticipantState.NONE, "Sender is not the origin of the transfer");
        }
        return messageFactory.ack(request, transfer.getState());
    }

    private ProtocolMessage replyFor(ProtocolMessage request, ParticipantTransfer recorded) {
        return switch (recorded.getState()) {
            case RESERVED, APPLIED -> messageFactory.ack(request, recorded.getState());
            default -> messageFactory.nack(request, recorded.getState(), recorded.getReason());
        };
    }

    private String validatePrepare(ProtocolMessage request) {
        if (request.getAmount() <= 0) {
            return "Amount must be positive";
        }
        Optional<Account> account = ledgerService.findAccount(request.getAccountId());
        if (account.isEmpty()) {
            return "Account not found";
        }
        if (!account.get().isActive()) {
            return "Account is " + account.get().getState();
        }
        return null;
    }

    private void releaseExpired(ParticipantTransferEntity entity, ParticipantTransfer transfer) {
        ledgerService.release(transfer.getTransferId(), ReservationDirection.CREDIT);
        entity.updateFromDomain(transfer.release("Reservation expired"));
        repository.save(entity);
        metrics.recordReservationExpired();
        log.info("Reservation for inbound transfer {} expired and was released", transfer.getTransferId());
    }
}
