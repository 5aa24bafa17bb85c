package com.flagship.toy_banking.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.toy_banking.transfer.Transfer;
import com.flagship.toy_banking.transfer.TransferStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("origin_id")
    String originId;

    @JsonProperty("destination_id")
    String destinationId;

    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @JsonProperty("destination_account_id")
    UUID destinationAccountId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("status")
    TransferStatus status;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TransferResponse from(Transfer transfer) {
        return TransferResponse.builder()
            .id(transfer.getId())
            .originId(transfer.getOriginId())
            .destinationId(transfer.getDestinationId())
            .sourceAccountId(transfer.getSourceAccountId())
            .destinationAccountId(transfer.getDestinationAccountId())
            .amount(transfer.getAmount())
            .status(transfer.getStatus())
            .failureReason(transfer.getFailureReason())
            .createdAt(transfer.getCreatedAt())
            .updatedAt(transfer.getUpdatedAt())
            .build();
    }
}
