package com.flagship.toy_banking.transfer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for transfers.
 *
 * No setters: status and failure reason change only through {@link #updateFromDomain}, and
 * everything else is fixed at insert. The idempotency key is a persistence concern and is
 * passed next to the domain object rather than carried by it.
 */
@Entity
@Table(
    name = "transfers",
    indexes = {
        @Index(name = "idx_transfers_idempotency_key", columnList = "idempotency_key"),
        @Index(name = "idx_transfers_status_updated", columnList = "status, updated_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransferEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "origin_id", nullable = false, updatable = false, length = 64)
    private String originId;

    @Column(name = "destination_id", nullable = false, updatable = false, length = 64)
    private String destinationId;

    @Column(name = "source_account_id", nullable = false, updatable = false)
    private UUID sourceAccountId;

    @Column(name = "destination_account_id", nullable = false, updatable = false)
    private UUID destinationAccountId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransferStatus status;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static TransferEntity fromDomain(Transfer transfer, String idempotencyKey) {
        return new TransferEntity(
            transfer.getId(),
            transfer.getOriginId(),
            transfer.getDestinationId(),
            transfer.getSourceAccountId(),
            transfer.getDestinationAccountId(),
            transfer.getAmount(),
            transfer.getStatus(),
            transfer.getFailureReason(),
            idempotencyKey,
            null, // set by @PrePersist
            null
        );
    }

    public Transfer toDomain() {
        return new Transfer(
            id,
            originId,
            destinationId,
            sourceAccountId,
            destinationAccountId,
            amount,
            status,
            failureReason,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(Transfer transfer) {
        this.status = transfer.getStatus();
        this.failureReason = transfer.getFailureReason();
    }
}
