package com.flagship.toy_banking.identity;

import lombok.Value;

import java.security.KeyPair;

/**
 * The identity of this bank instance: its instance id (swift code) and its keypair.
 * The private key never leaves the process; the public key is published to the registry.
 */
@Value
public class LocalIdentity {
    String instanceId;
    KeyPair keyPair;
}
