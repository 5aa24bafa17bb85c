package com.flagship.toy_banking.protocol;

import com.flagship.toy_banking.identity.IdentityService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;

/**
 * Builds signed protocol messages on behalf of this instance.
 *
 * Every message gets a fresh 16-byte nonce. A retry must resend the very same message
 * object, never a newly built one, so the participant recognizes it as a duplicate.
 */
@Component
@RequiredArgsConstructor
public class ProtocolMessageFactory {

    private static final int NONCE_BYTES = 16;

    private final IdentityService identityService;
    private final SecureRandom random = new SecureRandom();

    public ProtocolMessage prepare(UUID transferId, UUID accountId, long amount) {
        return sign(base(MessageType.PREPARE, transferId)
                .accountId(accountId)
                .amount(amount)
                .build());
    }

    public ProtocolMessage commit(UUID transferId) {
        return sign(base(MessageType.COMMIT, transferId).build());
    }

    public ProtocolMessage abort(UUID transferId) {
        return sign(base(MessageType.ABORT, transferId).build());
    }

    public ProtocolMessage query(UUID transferId) {
        return sign(base(MessageType.QUERY, transferId).build());
    }

    public ProtocolMessage ack(ProtocolMessage request, ParticipantState state) {
        return reply(MessageType.ACK, request, state, null);
    }

    public ProtocolMessage nack(ProtocolMessage request, ParticipantState state, String reason) {
        return reply(MessageType.NACK, request, state, reason);
    }

    private ProtocolMessage reply(MessageType type, ProtocolMessage request, ParticipantState state, String reason) {
        return sign(base(type, request.getTransferId())
                .state(state)
                .reason(reason)
                .requestNonce(request.getNonce())
                .build());
    }

    private ProtocolMessage.ProtocolMessageBuilder base(MessageType type, UUID transferId) {
        return ProtocolMessage.builder()
                .type(type)
                .transferId(transferId)
                .senderId(identityService.instanceId())
                .nonce(newNonce());
    }

    private ProtocolMessage sign(ProtocolMessage unsigned) {
        return unsigned.withSignature(identityService.sign(unsigned.signingPayload()));
    }

    private String newNonce() {
        byte[] bytes = new byte[NONCE_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
