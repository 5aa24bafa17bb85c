package com.flagship.toy_banking.discovery;

import lombok.Getter;

@Getter
public class InstanceNotFoundException extends RuntimeException {

    private final String instanceId;

    public InstanceNotFoundException(String instanceId) {
        super("Instance not registered: " + instanceId);
        this.instanceId = instanceId;
    }
}
