package com.flagship.toy_banking.participant;

import com.flagship.toy_banking.protocol.ParticipantState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ParticipantTransferRepository extends JpaRepository<ParticipantTransferEntity, UUID> {

    /**
     * Reservations whose deadline has passed, oldest deadline first.
     */
    @Query("""
        SELECT p.transferId FROM ParticipantTransferEntity p
        WHERE p.state = :state AND p.expiresAt <= :now
        ORDER BY p.expiresAt ASC
        """)
    List<UUID> findExpired(@Param("state") ParticipantState state,
                           @Param("now") Instant now,
                           Pageable pageable);
}
