package com.flagship.toy_banking.discovery;

import lombok.Builder;
import lombok.Value;

import java.security.PublicKey;

/**
 * A bank instance as published in the registry.
 */
@Value
@Builder
public class BankInstance {
    String instanceId;
    String name;
    String baseUrl;
    PublicKey publicKey;
    String region;
    String country;
}
