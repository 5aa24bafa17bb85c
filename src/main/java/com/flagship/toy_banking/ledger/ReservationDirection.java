package com.flagship.toy_banking.ledger;

/**
 * DEBIT is the hold placed by the origin on the source account; it counts against the
 * available balance. CREDIT is the destination's hold on incoming money; it does not touch
 * the balance until applied.
 */
public enum ReservationDirection {
    DEBIT,
    CREDIT;

    public EntryType entryType() {
        return this == DEBIT ? EntryType.DEBIT : EntryType.CREDIT;
    }
}
