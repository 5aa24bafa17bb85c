package com.flagship.toy_banking.transfer;

import com.flagship.toy_banking.ledger.InsufficientFundsException;
import com.flagship.toy_banking.ledger.LedgerService;
import com.flagship.toy_banking.ledger.ReservationDirection;
import com.flagship.toy_banking.outbox.OutboxService;
import com.flagship.toy_banking.transfer.event.TransferAbortedEvent;
import com.flagship.toy_banking.transfer.event.TransferCommittedEvent;
import com.flagship.toy_banking.transfer.event.TransferInitiatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Local state transitions of a transfer on the origin side.
 *
 * Each method is one database transaction: the transfer status, the debit hold or
 * posting, and the outbox event commit together or not at all. Methods reload the
 * transfer and are idempotent: a transition the transfer already went through returns
 * it unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferSettlementService {

    static final String AGGREGATE_TYPE = "Transfer";

    private final TransferPersistenceService persistenceService;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;

    /**
     * Persists a new transfer and places the debit hold on its source account.
     * Insufficient funds leave the transfer ABORTED instead of failing the call.
     */
    @Transactional
    public Transfer open(Transfer transfer, String idempotencyKey) {
        Transfer saved = persistenceService.insert(transfer, idempotencyKey);
        outboxService.saveEvent(AGGREGATE_TYPE, saved.getId(),
                TransferInitiatedEvent.EVENT_TYPE, TransferInitiatedEvent.fromTransfer(saved));

        try {
            ledgerService.reserveDebit(saved.getId(), saved.getSourceAccountId(), saved.getAmount());
        } catch (InsufficientFundsException e) {
            log.info("Insufficient funds for transfer {}: requested={}, available={}",
                    saved.getId(), e.getRequested(), e.getAvailable());
            return abortLocally(saved, "Insufficient funds");
        }

        log.info("Transfer initiated: amount={}, source={}, destination={}/{}",
                saved.getAmount(), saved.getSourceAccountId(), saved.getDestinationId(), saved.getDestinationAccountId());
        return saved;
    }

    @Transactional
    public Transfer markPrepared(UUID transferId) {
        Transfer transfer = persistenceService.getById(transferId);
        if (transfer.getStatus() != TransferStatus.INITIATED) {
            return transfer;
        }
        Transfer prepared = persistenceService.update(transfer.prepare());
        log.info("Transfer prepared: destination={}", prepared.getDestinationId());
        return prepared;
    }

    /**
     * Converts the debit hold into a posting. A transfer still INITIATED is moved through
     * PREPARED first (the destination may report APPLIED to any message).
     *
     * @throws IllegalStateException if the transfer was already ABORTED
     */
    @Transactional
    public Transfer commit(UUID transferId) {
        Transfer transfer = persistenceService.getById(transferId);
        if (transfer.getStatus() == TransferStatus.COMMITTED) {
            return transfer;
        }
        if (transfer.getStatus() == TransferStatus.ABORTED) {
            log.error("Destination applied transfer {} but it is already ABORTED locally: {}",
                    transferId, transfer.getFailureReason());
            throw new IllegalStateException("Transfer " + transferId + " is ABORTED and cannot commit");
        }

        ledgerService.apply(transferId, ReservationDirection.DEBIT);
        Transfer committed = persistenceService.update(transfer.prepare().commit());
        outboxService.saveEvent(AGGREGATE_TYPE, transferId,
                TransferCommittedEvent.EVENT_TYPE, TransferCommittedEvent.fromTransfer(committed));

        log.info("Transfer committed: amount={}, source={}", committed.getAmount(), committed.getSourceAccountId());
        return committed;
    }

    /**
     * Releases the debit hold and marks the transfer ABORTED.
     * A COMMITTED transfer is returned unchanged.
     */
    @Transactional
    public Transfer abort(UUID transferId, String reason) {
        Transfer transfer = persistenceService.getById(transferId);
        if (transfer.isTerminal()) {
            if (transfer.getStatus() == TransferStatus.COMMITTED) {
                log.warn("Ignoring abort of committed transfer {}: {}", transferId, reason);
            }
            return transfer;
        }
        return abortLocally(transfer, reason);
    }

    private Transfer abortLocally(Transfer transfer, String reason) {
        ledgerService.release(transfer.getId(), ReservationDirection.DEBIT);
        Transfer aborted = persistenceService.update(transfer.abort(reason));
        outboxService.saveEvent(AGGREGATE_TYPE, aborted.getId(),
                TransferAbortedEvent.EVENT_TYPE, TransferAbortedEvent.fromTransfer(aborted));

        log.info("Transfer aborted: reason={}", reason);
        return aborted;
    }
}
