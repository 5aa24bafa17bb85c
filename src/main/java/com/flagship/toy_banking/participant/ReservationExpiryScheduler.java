package com.flagship.toy_banking.participant;

import com.flagship.toy_banking.concurrency.EntityLockRegistry;
import com.flagship.toy_banking.config.BankProperties;
import com.flagship.toy_banking.protocol.ParticipantState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Releases inbound reservations whose deadline passed without a COMMIT, and purges replay
 * records older than the retention window.
 *
 * A COMMIT arriving after the release is answered with a NACK.
 */
@Component
@ConditionalOnProperty(name = "bank.participant.expiry.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReservationExpiryScheduler {

    private static final int BATCH_SIZE = 100;

    private final ParticipantTransferRepository repository;
    private final ParticipantDecisionService decisionService;
    private final ReplayGuard replayGuard;
    private final EntityLockRegistry lockRegistry;
    private final BankProperties properties;

    @Scheduled(fixedDelayString = "${bank.participant.expiry.interval-ms:5000}")
    public void releaseExpiredReservations() {
        try {
            Instant now = Instant.now();
            List<UUID> expired = repository.findExpired(ParticipantState.RESERVED, now, PageRequest.of(0, BATCH_SIZE));
            int released = 0;
            for (UUID transferId : expired) {
                boolean done = lockRegistry.withLock(EntityLockRegistry.participantKey(transferId),
                        () -> decisionService.expire(transferId, now));
                if (done) {
                    released++;
                }
            }
            if (released > 0) {
                log.info("Released {} expired inbound reservations", released);
            }
        } catch (Exception e) {
            log.error("Error in reservation expiry sweep", e);
        }
    }

    @Scheduled(cron = "${bank.participant.purge.cron:0 17 * * * *}")
    public void purgeProcessedMessages() {
        try {
            Instant cutoff = Instant.now().minus(properties.getProtocol().getProcessedMessageRetention());
            int purged = replayGuard.purgeProcessedBefore(cutoff);
            if (purged > 0) {
                log.info("Purged {} processed protocol messages older than {}", purged, cutoff);
            }
        } catch (Exception e) {
            log.error("Error purging processed protocol messages", e);
        }
    }
}
