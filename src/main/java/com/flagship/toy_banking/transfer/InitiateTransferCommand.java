package com.flagship.toy_banking.transfer;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Input of {@link TransferCoordinator#initiate}. transferId and idempotencyKey are optional.
 */
@Value
@Builder
public class InitiateTransferCommand {
    UUID transferId;
    UUID sourceAccountId;
    String destinationInstanceId;
    UUID destinationAccountId;
    long amount;
    String idempotencyKey;
}
