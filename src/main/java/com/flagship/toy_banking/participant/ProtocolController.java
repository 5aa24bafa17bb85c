package com.flagship.toy_banking.participant;

import com.flagship.toy_banking.protocol.ProtocolMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Wire endpoint of the participant: a signed JSON envelope in, a signed JSON reply out.
 * Rejections are mapped to 401 (signature), 409 (replay) and 503 (storage or registry down).
 */
@RestController
@RequestMapping("/protocol")
@RequiredArgsConstructor
public class ProtocolController {

    private final TransferParticipant participant;

    @PostMapping("/messages")
    public ResponseEntity<ProtocolMessage> receive(@RequestBody ProtocolMessage message) {
        return ResponseEntity.ok(participant.handle(message));
    }
}
