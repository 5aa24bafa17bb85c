package com.flagship.toy_banking.protocol;

/**
 * Transport for protocol requests to a remote participant.
 */
public interface ParticipantClient {

    /**
     * Sends a signed request and returns the participant's signed reply, unverified.
     *
     * @throws RemoteUnreachableException on network failure, timeout or a server error
     * @throws MessageRejectedException if the participant refused the envelope
     */
    ProtocolMessage send(String baseUrl, ProtocolMessage request);
}
