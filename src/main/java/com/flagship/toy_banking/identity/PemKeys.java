package com.flagship.toy_banking.identity;

import java.io.ByteArrayOutputStream;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * PEM encoding and decoding of RSA keys.
 *
 * Supported formats:
 * - Public keys: X.509 SubjectPublicKeyInfo ("BEGIN PUBLIC KEY"), the format published in the registry
 * - Private keys: PKCS#8 ("BEGIN PRIVATE KEY") and PKCS#1 ("BEGIN RSA PRIVATE KEY"), the latter
 *   being what OpenSSL-style key generators write by default
 */
public final class PemKeys {

    private static final String PUBLIC_KEY = "PUBLIC KEY";
    private static final String PRIVATE_KEY = "PRIVATE KEY";
    private static final String RSA_PRIVATE_KEY = "RSA PRIVATE KEY";

    // AlgorithmIdentifier for rsaEncryption (1.2.840.113549.1.1.1) with NULL parameters
    private static final byte[] RSA_ALGORITHM_IDENTIFIER = {
        0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86,
        (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    private PemKeys() {
        // Utility class
    }

    public static PublicKey readPublicKey(String pem) {
        byte[] der = decode(pem, PUBLIC_KEY);
        try {
            return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid RSA public key", e);
        }
    }

    public static PrivateKey readPrivateKey(String pem) {
        byte[] der = pem.contains(RSA_PRIVATE_KEY)
            ? wrapPkcs1(decode(pem, RSA_PRIVATE_KEY))
            : decode(pem, PRIVATE_KEY);
        try {
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid RSA private key", e);
        }
    }

    public static String toPem(PublicKey key) {
        return encode(key.getEncoded(), PUBLIC_KEY);
    }

    /**
     * Writes the key as PKCS#8, the encoding the JDK produces natively.
     */
    public static String toPem(PrivateKey key) {
        return encode(key.getEncoded(), PRIVATE_KEY);
    }

    private static String encode(byte[] der, String label) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes()).encodeToString(der);
        return "-----BEGIN " + label + "-----\n" + body + "\n-----END " + label + "-----\n";
    }

    private static byte[] decode(String pem, String label) {
        if (pem == null) {
            throw new IllegalArgumentException("PEM content is required");
        }
        String begin = "-----BEGIN " + label + "-----";
        String end = "-----END " + label + "-----";
        int start = pem.indexOf(begin);
        int stop = pem.indexOf(end);
        if (start < 0 || stop < start) {
            throw new IllegalArgumentException("Expected a PEM block of type " + label);
        }
        String body = pem.substring(start + begin.length(), stop).replaceAll("\\s", "");
        try {
            return Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("PEM body is not valid Base64", e);
        }
    }

    /**
     * Wraps a PKCS#1 RSAPrivateKey into a PKCS#8 PrivateKeyInfo:
     * SEQUENCE { INTEGER 0, AlgorithmIdentifier, OCTET STRING pkcs1 }.
     */
    static byte[] wrapPkcs1(byte[] pkcs1) {
        ByteArrayOutputStream inner = new ByteArrayOutputStream();
        inner.write(new byte[] {0x02, 0x01, 0x00}, 0, 3);
        inner.write(RSA_ALGORITHM_IDENTIFIER, 0, RSA_ALGORITHM_IDENTIFIER.length);
        inner.write(0x04);
        writeLength(inner, pkcs1.length);
        inner.write(pkcs1, 0, pkcs1.length);

        byte[] content = inner.toByteArray();
        ByteArrayOutputStream outer = new ByteArrayOutputStream();
        outer.write(0x30);
        writeLength(outer, content.length);
        outer.write(content, 0, content.length);
        return outer.toByteArray();
    }

    private static void writeLength(ByteArrayOutputStream out, int length) {
        if (length < 0x80) {
            out.write(length);
        } else if (length <= 0xff) {
            out.write(0x81);
            out.write(length);
        } else if (length <= 0xffff) {
            out.write(0x82);
            out.write(length >> 8);
            out.write(length & 0xff);
        } else {
            out.write(0x83);
            out.write(length >> 16);
            out.write((length >> 8) & 0xff);
            out.write(length & 0xff);
        }
    }
}
