package com.flagship.toy_banking.transfer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the Transfer domain object and its JPA entity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferPersistenceService {

    private final TransferRepository transferRepository;

    /**
     * Inserts a new transfer, flushing so a duplicate id or idempotency key fails here
     * and not at commit.
     */
    @Transactional
    public Transfer insert(Transfer transfer, String idempotencyKey) {
        TransferEntity saved = transferRepository.saveAndFlush(TransferEntity.fromDomain(transfer, idempotencyKey));
        log.debug("Saved transfer {} with idempotency key {}", saved.getId(), idempotencyKey);
        return saved.toDomain();
    }

    @Transactional
    public Transfer update(Transfer transfer) {
        TransferEntity existing = transferRepository.findById(transfer.getId())
            .orElseThrow(() -> new TransferNotFoundException(transfer.getId()));
        existing.updateFromDomain(transfer);
        return transferRepository.save(existing).toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Transfer> findById(UUID transferId) {
        return transferRepository.findById(transferId).map(TransferEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Transfer getById(UUID transferId) {
        return findById(transferId).orElseThrow(() -> new TransferNotFoundException(transferId));
    }

    /**
     * Non-terminal transfers not updated since {@code before}.
     */
    @Transactional(readOnly = true)
    public List<UUID> findStale(Instant before, int limit) {
        return transferRepository.findStale(
            EnumSet.of(TransferStatus.INITIATED, TransferStatus.PREPARED), before, PageRequest.of(0, limit));
    }
}
