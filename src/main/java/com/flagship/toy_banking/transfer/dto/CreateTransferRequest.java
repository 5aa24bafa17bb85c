package com.flagship.toy_banking.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * Request DTO for starting a transfer. Amounts are minor currency units.
 */
@Value
@Builder
@Jacksonized
public class CreateTransferRequest {

    @JsonProperty("transfer_id")
    UUID transferId;

    @NotNull(message = "Source account ID is required")
    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @NotBlank(message = "Destination instance is required")
    @JsonProperty("destination_instance_id")
    String destinationInstanceId;

    @NotNull(message = "Destination account ID is required")
    @JsonProperty("destination_account_id")
    UUID destinationAccountId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;
}
