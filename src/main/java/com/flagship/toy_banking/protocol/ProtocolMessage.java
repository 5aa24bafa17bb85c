package com.flagship.toy_banking.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Signed envelope exchanged between a coordinator and a participant.
 *
 * Requests (PREPARE, COMMIT, ABORT, QUERY) go from origin to destination; every request is
 * answered by an ACK or NACK signed by the destination. {@code accountId} and
 * {@code amount} are only set on PREPARE; {@code state}, {@code reason} and
 * {@code requestNonce} only on replies. {@code requestNonce} is the nonce of the request
 * being answered, which binds a reply to exactly one request.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProtocolMessage {

    @JsonProperty("type")
    MessageType type;

    @JsonProperty("transfer_id")
    UUID transferId;

    @JsonProperty("sender_id")
    String senderId;

    @JsonProperty("nonce")
    String nonce;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("amount")
    Long amount;

    @JsonProperty("state")
    ParticipantState state;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("request_nonce")
    String requestNonce;

    @JsonProperty("signature")
    String signature;

    /**
     * Canonical bytes covered by the signature.
     *
     * Each field is written as a 4-byte length followed by its UTF-8 bytes (length -1 for
     * an absent field), in the order type, sender, account, amount, state, reason, request
     * nonce, then nonce and transfer id. Length prefixes keep two different field splits from
     * producing the same bytes.
     */
    public byte[] signingPayload() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            writeField(out, type);
            writeField(out, senderId);
            writeField(out, accountId);
            writeField(out, amount);
            writeField(out, state);
            writeField(out, reason);
            writeField(out, requestNonce);
            writeField(out, nonce);
            writeField(out, transferId);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /**
     * Hex SHA-256 of the signing payload. Two messages with the same digest carry the same content.
     */
    public String payloadDigest() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(signingPayload()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public ProtocolMessage withSignature(String signature) {
        return toBuilder().signature(signature).build();
    }

    private static void writeField(DataOutputStream out, Object value) throws IOException {
        if (value == null) {
            out.writeInt(-1);
            return;
        }
        byte[] encoded = value.toString().getBytes(StandardCharsets.UTF_8);
        out.writeInt(encoded.length);
        out.write(encoded);
    }
}
