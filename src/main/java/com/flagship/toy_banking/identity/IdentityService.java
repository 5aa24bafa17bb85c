package com.flagship.toy_banking.identity;

import com.flagship.toy_banking.discovery.BankInstance;
import com.flagship.toy_banking.discovery.DiscoveryClient;
import com.flagship.toy_banking.discovery.InstanceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.util.Base64;

/**
 * Signs outbound protocol messages and verifies inbound ones.
 *
 * Signatures are SHA256withRSA, Base64 encoded. The verifying key of a remote sender is
 * always the one published in the registry; a registry outage propagates as
 * RemoteUnreachableException instead of being reported as a bad signature.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityService {

    static final String ALGORITHM = "SHA256withRSA";

    private final LocalIdentity localIdentity;
    private final DiscoveryClient discoveryClient;

    public String instanceId() {
        return localIdentity.getInstanceId();
    }

    public String sign(byte[] payload) {
        try {
            Signature signer = Signature.getInstance(ALGORITHM);
            signer.initSign(localIdentity.getKeyPair().getPrivate());
            signer.update(payload);
            return Base64.getEncoder().encodeToString(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signing failed", e);
        }
    }

    /**
     * Verifies a signature made by the given sender.
     *
     * @return false for an unknown sender, a malformed signature or a mismatch
     */
    public boolean verify(String senderId, byte[] payload, String signature) {
        if (senderId == null || senderId.isBlank()) {
            return false;
        }
        BankInstance sender;
        try {
            sender = discoveryClient.resolve(senderId);
        } catch (InstanceNotFoundException e) {
            log.warn("Signature from unknown instance rejected: senderId={}", senderId);
            return false;
        }
        return verify(sender.getPublicKey(), payload, signature);
    }

    public boolean verify(PublicKey publicKey, byte[] payload, String signature) {
        if (publicKey == null || signature == null || signature.isBlank()) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(payload);
            return verifier.verify(Base64.getDecoder().decode(signature));
        } catch (IllegalArgumentException | SignatureException e) {
            // Not Base64, or not a well-formed RSA signature
            return false;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signature verification failed", e);
        }
    }
}
