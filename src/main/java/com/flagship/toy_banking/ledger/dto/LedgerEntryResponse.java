package com.flagship.toy_banking.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.toy_banking.ledger.EntryType;
import com.flagship.toy_banking.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transfer_id")
    UUID transferId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("entry_type")
    EntryType entryType;

    @JsonProperty("description")
    String description;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .transferId(entry.getTransferId())
            .amount(entry.getAmount())
            .entryType(entry.getEntryType())
            .description(entry.getDescription())
            .sequenceNumber(entry.getSequenceNumber())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
