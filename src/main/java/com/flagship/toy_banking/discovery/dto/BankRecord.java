package com.flagship.toy_banking.discovery.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Registry representation of a bank: {@code {swift, name, bank_metadata: {...}}}.
 */
@Value
@Builder
@Jacksonized
public class BankRecord {

    String swift;

    String name;

    @JsonProperty("bank_metadata")
    Metadata bankMetadata;

    @Value
    @Builder
    @Jacksonized
    public static class Metadata {

        @JsonProperty("base_url")
        String baseUrl;

        @JsonProperty("public_key")
        String publicKey;

        String region;

        String country;
    }
}
