package com.flagship.toy_banking.transfer;

import com.flagship.toy_banking.config.BankProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Periodically resolves transfers left INITIATED or PREPARED by a crash or an unreachable
 * destination.
 */
@Component
@ConditionalOnProperty(name = "bank.recovery.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class TransferRecoveryScheduler {

    private final TransferPersistenceService persistenceService;
    private final TransferCoordinator coordinator;
    private final BankProperties properties;

    @Scheduled(fixedDelayString = "${bank.recovery.interval-ms:30000}")
    public void recoverStaleTransfers() {
        Instant before = Instant.now().minus(properties.getRecovery().getStaleAfter());
        List<UUID> stale;
        try {
            stale = persistenceService.findStale(before, properties.getRecovery().getBatchSize());
        } catch (Exception e) {
            log.error("Error loading stale transfers", e);
            return;
        }
        if (stale.isEmpty()) {
            return;
        }

        log.info("Recovering {} stale transfers", stale.size());
        for (UUID transferId : stale) {
            try {
                coordinator.recover(transferId);
            } catch (Exception e) {
                log.error("Error recovering transfer {}", transferId, e);
            }
        }
    }
}
