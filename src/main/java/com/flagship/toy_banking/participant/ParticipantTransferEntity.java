package com.flagship.toy_banking.participant;

import com.flagship.toy_banking.protocol.ParticipantState;
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
 * JPA entity for participant_transfers. Only state and reason change after insert.
 */
@Entity
@Table(
    name = "participant_transfers",
    indexes = @Index(name = "idx_participant_transfers_state_expiry", columnList = "state, expires_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ParticipantTransferEntity {

    @Id
    @Column(name = "transfer_id", nullable = false, updatable = false)
    private UUID transferId;

    @Column(name = "origin_id", nullable = false, updatable = false)
    private String originId;

    @Column(name = "account_id", updatable = false)
    private UUID accountId;

    @Column(name = "amount", updatable = false)
    private Long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ParticipantState state;

    @Column(name = "reason")
    private String reason;

    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

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

    static ParticipantTransferEntity fromDomain(ParticipantTransfer transfer) {
        return new ParticipantTransferEntity(
            transfer.getTransferId(),
            transfer.getOriginId(),
            transfer.getAccountId(),
            transfer.getAmount(),
            transfer.getState(),
            transfer.getReason(),
            transfer.getExpiresAt(),
            transfer.getCreatedAt(),
            transfer.getUpdatedAt()
        );
    }

    ParticipantTransfer toDomain() {
        return new ParticipantTransfer(
            transferId,
            originId,
            accountId,
            amount,
            state,
            reason,
            expiresAt,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(ParticipantTransfer transfer) {
        this.state = transfer.getState();
        this.reason = transfer.getReason();
    }
}
