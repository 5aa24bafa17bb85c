package com.flagship.toy_banking.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for transfers and protocol traffic.
 *
 * Metrics exposed:
 * - transfers.initiated / transfers.completed{status}: coordinator lifecycle
 * - transfers.duration: initiate to terminal (or in-doubt) status
 * - protocol.messages{direction,type,result}: inbound and outbound protocol messages
 * - protocol.rejected{reason}: inbound messages refused before dispatch
 * - protocol.retries{type}: resends of an unanswered request
 * - reservations.expired: destination holds released by the expiry sweep or a late commit
 * - idempotency.cache{result}: client idempotency key lookups
 */
@Component
public class TransferMetrics {

    private final MeterRegistry registry;
    private final Timer transferTimer;

    public TransferMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.transferTimer = Timer.builder("transfers.duration")
                .description("Time from initiation to the end of the protocol run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordTransferInitiated() {
        registry.counter("transfers.initiated").increment();
    }

    public void recordTransferCompleted(String status) {
        registry.counter("transfers.completed", "status", sanitizeTag(status)).increment();
    }

    public void recordTransferDuration(Duration duration) {
        transferTimer.record(duration);
    }

    public void recordOutbound(String type, String result) {
        registry.counter("protocol.messages",
                "direction", "outbound",
                "type", sanitizeTag(type),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordInbound(String type, String result) {
        registry.counter("protocol.messages",
                "direction", "inbound",
                "type", sanitizeTag(type),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordRejected(String reason) {
        registry.counter("protocol.rejected", "reason", sanitizeTag(reason)).increment();
    }

    public void recordRetry(String type) {
        registry.counter("protocol.retries", "type", sanitizeTag(type)).increment();
    }

    public void recordReservationExpired() {
        registry.counter("reservations.expired").increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag values to a small safe alphabet to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
