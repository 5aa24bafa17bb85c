package com.flagship.toy_banking.identity;

import com.flagship.toy_banking.config.BankProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;

import static org.junit.jupiter.api.Assertions.*;

class KeyPairLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Missing key files are generated and reused on the next start")
    void generatesThenReloads() {
        BankProperties.Keys keys = keys(tempDir.resolve("keys/private.pem"), tempDir.resolve("keys/public.pem"));

        KeyPair first = new KeyPairLoader(keys).load();

        assertTrue(Files.exists(tempDir.resolve("keys/private.pem")));
        assertTrue(Files.exists(tempDir.resolve("keys/public.pem")));

        KeyPair second = new KeyPairLoader(keys).load();
        assertArrayEquals(first.getPublic().getEncoded(), second.getPublic().getEncoded());
        assertArrayEquals(first.getPrivate().getEncoded(), second.getPrivate().getEncoded());
    }

    @Test
    @DisplayName("Public key is derived when only the private key file exists")
    void derivesPublicKey() throws Exception {
        KeyPair generated = KeyPairLoader.generate();
        Path privateFile = tempDir.resolve("private.pem");
        Files.writeString(privateFile, PemKeys.toPem(generated.getPrivate()));

        KeyPair loaded = new KeyPairLoader(keys(privateFile, null)).load();

        assertArrayEquals(generated.getPublic().getEncoded(), loaded.getPublic().getEncoded());
    }

    @Test
    @DisplayName("Without a configured path an in-memory keypair is used")
    void ephemeralKeyPair() {
        KeyPair keyPair = new KeyPairLoader(new BankProperties.Keys()).load();

        assertNotNull(keyPair.getPrivate());
        assertEquals("RSA", keyPair.getPublic().getAlgorithm());
    }

    @Test
    @DisplayName("Generation can be forbidden")
    void generationDisabled() {
        BankProperties.Keys keys = keys(tempDir.resolve("absent.pem"), null);
        keys.setGenerateIfMissing(false);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new KeyPairLoader(keys).load());
        assertTrue(e.getMessage().contains("does not exist"));
        assertFalse(Files.exists(tempDir.resolve("absent.pem")));
    }

    private static BankProperties.Keys keys(Path privateFile, Path publicFile) {
        BankProperties.Keys keys = new BankProperties.Keys();
        keys.setPrivateKeyPath(privateFile.toString());
        keys.setPublicKeyPath(publicFile != null ? publicFile.toString() : null);
        return keys;
    }
}
