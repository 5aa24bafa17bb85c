package com.flagship.toy_banking.participant;

import com.flagship.toy_banking.protocol.MessageType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for processed_messages: one row per accepted (sender, nonce, transfer id).
 */
@Entity
@Table(
    name = "processed_messages",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_processed_messages_sender_nonce_transfer",
        columnNames = {"sender_id", "nonce", "transfer_id"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedMessageEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "sender_id", nullable = false, updatable = false, length = 64)
    private String senderId;

    @Column(name = "nonce", nullable = false, updatable = false, length = 64)
    private String nonce;

    @Column(name = "transfer_id", nullable = false, updatable = false)
    private UUID transferId;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false, updatable = false, length = 16)
    private MessageType messageType;

    @Column(name = "payload_digest", nullable = false, updatable = false, length = 64)
    private String payloadDigest;

    @Column(name = "reply", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String reply;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    static ProcessedMessageEntity of(String senderId, String nonce, UUID transferId, MessageType messageType,
                                     String payloadDigest, String reply) {
        ProcessedMessageEntity entity = new ProcessedMessageEntity();
        entity.id = UUID.randomUUID();
        entity.senderId = senderId;
        entity.nonce = nonce;
        entity.transferId = transferId;
        entity.messageType = messageType;
        entity.payloadDigest = payloadDigest;
        entity.reply = reply;
        entity.processedAt = Instant.now();
        return entity;
    }
}
