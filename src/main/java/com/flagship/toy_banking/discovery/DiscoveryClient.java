package com.flagship.toy_banking.discovery;

/**
 * Lookup and registration of bank instances.
 */
public interface DiscoveryClient {

    /**
     * Resolves an instance by its id.
     *
     * @throws InstanceNotFoundException if the registry has no record for the id
     * @throws com.flagship.toy_banking.protocol.RemoteUnreachableException if the registry
     *         cannot be reached or does not answer in time
     */
    BankInstance resolve(String instanceId);

    /**
     * Publishes the given instance. Registering an id that already exists is not an error.
     */
    void register(BankInstance instance);
}
