package com.flagship.toy_banking.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.toy_banking.ledger.Account;
import com.flagship.toy_banking.ledger.AccountState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("owner_name")
    String ownerName;

    @JsonProperty("state")
    AccountState state;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("reserved")
    long reserved;

    @JsonProperty("available")
    long available;

    @JsonProperty("version")
    long version;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .accountNumber(account.getAccountNumber())
            .ownerName(account.getOwnerName())
            .state(account.getState())
            .balance(account.getBalance())
            .reserved(account.getReserved())
            .available(account.available())
            .version(account.getVersion())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
