package com.flagship.toy_banking.transfer;

/**
 * Coordinator-side status of a transfer.
 *
 * INITIATED -> PREPARED -> COMMITTED
 * INITIATED | PREPARED -> ABORTED
 *
 * COMMITTED and ABORTED are terminal.
 */
public enum TransferStatus {
    INITIATED,
    PREPARED,
    COMMITTED,
    ABORTED
}
