package com.flagship.toy_banking.transfer;

import com.flagship.toy_banking.transfer.dto.CreateTransferRequest;
import com.flagship.toy_banking.transfer.dto.TransferResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Client-facing transfer API.
 *
 * POST runs the protocol synchronously and answers with the status reached: COMMITTED or
 * ABORTED normally, PREPARED when the destination stopped answering mid-commit. The
 * optional Idempotency-Key header (or a caller-chosen transfer_id) makes the call safe to
 * repeat: a repeat answers 200 with the stored transfer instead of 201.
 */
@RestController
@RequestMapping("/api/transfers")
@RequiredArgsConstructor
@Slf4j
public class TransferController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TransferCoordinator coordinator;
    private final TransferPersistenceService persistenceService;

    @PostMapping
    public ResponseEntity<TransferResponse> createTransfer(
            @Valid @RequestBody CreateTransferRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received transfer request: idempotencyKey={}, amount={}, destination={}",
                idempotencyKey, request.getAmount(), request.getDestinationInstanceId());

        InitiationResult result = coordinator.initiate(InitiateTransferCommand.builder()
                .transferId(request.getTransferId())
                .sourceAccountId(request.getSourceAccountId())
                .destinationInstanceId(request.getDestinationInstanceId())
                .destinationAccountId(request.getDestinationAccountId())
                .amount(request.getAmount())
                .idempotencyKey(idempotencyKey)
                .build());

        HttpStatus status = result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(TransferResponse.from(result.getTransfer()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransferResponse> getTransfer(@PathVariable("id") UUID id) {
        return persistenceService.findById(id)
            .map(transfer -> ResponseEntity.ok(TransferResponse.from(transfer)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<TransferResponse> cancelTransfer(@PathVariable("id") UUID id) {
        log.info("Received cancel request for transfer {}", id);
        return ResponseEntity.ok(TransferResponse.from(coordinator.cancel(id)));
    }
}
