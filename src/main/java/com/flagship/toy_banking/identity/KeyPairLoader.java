package com.flagship.toy_banking.identity;

import com.flagship.toy_banking.config.BankProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.spec.RSAPublicKeySpec;
import java.util.Optional;

/**
 * Loads the instance keypair from PEM files, generating a fresh RSA-2048 pair when allowed.
 *
 * Resolution order:
 * 1. Private key file present: load it; the public key comes from its file or is derived
 * 2. Private key file configured but missing: generate and write both files
 * 3. No path configured: generate an in-memory pair (lost on restart)
 */
@Slf4j
public class KeyPairLoader {

    static final int KEY_SIZE = 2048;

    private final BankProperties.Keys keys;

    public KeyPairLoader(BankProperties.Keys keys) {
        this.keys = keys;
    }

    public KeyPair load() {
        String privatePath = keys.getPrivateKeyPath();
        if (privatePath == null || privatePath.isBlank()) {
            requireGeneration("no private key path configured");
            log.warn("No private key path configured, using an ephemeral in-memory keypair");
            return generate();
        }

        Path privateFile = Path.of(privatePath);
        if (Files.exists(privateFile)) {
            PrivateKey privateKey = PemKeys.readPrivateKey(read(privateFile));
            PublicKey publicKey = publicKeyFile()
                .filter(Files::exists)
                .map(path -> PemKeys.readPublicKey(read(path)))
                .orElseGet(() -> derivePublicKey(privateKey));
            log.info("Loaded instance keypair from {}", privateFile);
            return new KeyPair(publicKey, privateKey);
        }

        requireGeneration("private key file " + privateFile + " does not exist");
        KeyPair keyPair = generate();
        write(privateFile, PemKeys.toPem(keyPair.getPrivate()));
        publicKeyFile().ifPresent(path -> write(path, PemKeys.toPem(keyPair.getPublic())));
        log.info("Generated a new instance keypair at {}", privateFile);
        return keyPair;
    }

    public static KeyPair generate() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(KEY_SIZE);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("RSA key generation is not available", e);
        }
    }

    private Optional<Path> publicKeyFile() {
        String publicPath = keys.getPublicKeyPath();
        return publicPath == null || publicPath.isBlank()
            ? Optional.empty()
            : Optional.of(Path.of(publicPath));
    }

    private void requireGeneration(String why) {
        if (!keys.isGenerateIfMissing()) {
            throw new IllegalStateException("Cannot load instance keypair: " + why);
        }
    }

    private static PublicKey derivePublicKey(PrivateKey privateKey) {
        if (!(privateKey instanceof RSAPrivateCrtKey)) {
            throw new IllegalStateException("Public key file is required for this private key type");
        }
        RSAPrivateCrtKey crtKey = (RSAPrivateCrtKey) privateKey;
        try {
            return KeyFactory.getInstance("RSA")
                .generatePublic(new RSAPublicKeySpec(crtKey.getModulus(), crtKey.getPublicExponent()));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot derive public key", e);
        }
    }

    private static String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read key file " + path, e);
        }
    }

    private static void write(Path path, String pem) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, pem, StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write key file " + path, e);
        }
    }
}
