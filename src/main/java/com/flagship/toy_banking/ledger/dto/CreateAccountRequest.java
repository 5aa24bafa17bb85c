package com.flagship.toy_banking.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CreateAccountRequest {

    @NotBlank(message = "Account number is required")
    @Size(max = 64, message = "Account number must be at most 64 characters")
    @JsonProperty("account_number")
    String accountNumber;

    @NotBlank(message = "Owner name is required")
    @JsonProperty("owner_name")
    String ownerName;

    @PositiveOrZero(message = "Initial balance cannot be negative")
    @JsonProperty("initial_balance")
    long initialBalance;
}
