package com.flagship.toy_banking.participant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProcessedMessageRepository extends JpaRepository<ProcessedMessageEntity, UUID> {

    Optional<ProcessedMessageEntity> findBySenderIdAndNonceAndTransferId(String senderId, String nonce, UUID transferId);

    @Modifying
    @Query("DELETE FROM ProcessedMessageEntity m WHERE m.processedAt < :before")
    int deleteProcessedBefore(@Param("before") Instant before);
}
