package com.flagship.toy_banking.protocol;

/**
 * State of a transfer as recorded by the destination participant.
 *
 * NONE is never stored: it is what the participant reports for a transfer id it has no
 * record of.
 */
public enum ParticipantState {
    NONE,
    RESERVED,
    APPLIED,
    RELEASED,
    REJECTED
}
