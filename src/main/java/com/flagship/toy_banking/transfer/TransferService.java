package com.flagship.toy_banking.transfer;

import com.flagship.toy_banking.ledger.Account;
import com.flagship.toy_banking.ledger.AccountService;
import com.flagship.toy_banking.transfer.exception.TransferValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Validates transfer requests and builds new transfers in INITIATED status.
 */
@Service
@RequiredArgsConstructor
public class TransferService {

    private final AccountService accountService;

    /**
     * Checks the request without writing anything.
     *
     * @throws TransferValidationException if the request is malformed or the source account
     *         cannot send money
     */
    public void validate(InitiateTransferCommand command, String localInstanceId) {
        if (command.getAmount() <= 0) {
            throw new TransferValidationException("Transfer amount must be positive");
        }
        if (command.getDestinationInstanceId() == null || command.getDestinationInstanceId().isBlank()) {
            throw new TransferValidationException("Destination instance is required");
        }
        if (command.getSourceAccountId() == null || command.getDestinationAccountId() == null) {
            throw new TransferValidationException("Source and destination accounts are required");
        }
        if (command.getDestinationInstanceId().equals(localInstanceId)
                && command.getSourceAccountId().equals(command.getDestinationAccountId())) {
            throw new TransferValidationException("Source and destination accounts must be different");
        }
        if (command.getIdempotencyKey() != null && command.getIdempotencyKey().isBlank()) {
            throw new TransferValidationException("Idempotency key cannot be blank");
        }

        Optional<Account> source = accountService.findAccount(command.getSourceAccountId());
        if (source.isEmpty()) {
            throw new TransferValidationException("Source account not found: " + command.getSourceAccountId());
        }
        if (!source.get().isActive()) {
            throw new TransferValidationException(
                "Source account " + command.getSourceAccountId() + " is " + source.get().getState());
        }
    }

    public Transfer createTransfer(InitiateTransferCommand command, String localInstanceId) {
        UUID transferId = command.getTransferId() != null ? command.getTransferId() : UUID.randomUUID();
        return Transfer.initiate(
            transferId,
            localInstanceId,
            command.getDestinationInstanceId(),
            command.getSourceAccountId(),
            command.getDestinationAccountId(),
            command.getAmount()
        );
    }
}
