package com.flagship.toy_banking.discovery;

import com.flagship.toy_banking.config.BankProperties;
import com.flagship.toy_banking.identity.LocalIdentity;
import com.flagship.toy_banking.protocol.RemoteUnreachableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Publishes this instance to the registry once the application is ready to serve.
 *
 * A registry outage does not stop the instance: it keeps serving local requests and can
 * be registered later by a restart.
 */
@Component
@ConditionalOnProperty(name = "bank.registry.register-on-startup", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InstanceRegistrar {

    private final DiscoveryClient discoveryClient;
    private final LocalIdentity localIdentity;
    private final BankProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void registerSelf() {
        BankInstance self = BankInstance.builder()
                .instanceId(localIdentity.getInstanceId())
                .name(properties.getName())
                .baseUrl(properties.getBaseUrl())
                .publicKey(localIdentity.getKeyPair().getPublic())
                .region(properties.getRegion())
                .country(properties.getCountry())
                .build();
        try {
            discoveryClient.register(self);
        } catch (RemoteUnreachableException e) {
            log.error("Registration of instance {} failed: {}", self.getInstanceId(), e.getMessage());
        }
    }
}
