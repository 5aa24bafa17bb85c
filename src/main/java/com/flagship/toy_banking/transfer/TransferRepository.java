package com.flagship.toy_banking.transfer;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransferRepository extends JpaRepository<TransferEntity, UUID> {

    Optional<TransferEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * Transfers in one of the given statuses untouched since {@code before}, oldest first.
     */
    @Query("""
        SELECT t.id FROM TransferEntity t
        WHERE t.status IN :statuses AND t.updatedAt < :before
        ORDER BY t.updatedAt ASC
        """)
    List<UUID> findStale(@Param("statuses") Collection<TransferStatus> statuses,
                         @Param("before") Instant before,
                         Pageable pageable);
}
