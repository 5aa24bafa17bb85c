package com.flagship.toy_banking.identity;

import com.flagship.toy_banking.config.BankProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IdentityConfig {

    @Bean
    public LocalIdentity localIdentity(BankProperties properties) {
        if (properties.getInstanceId() == null || properties.getInstanceId().isBlank()) {
            throw new IllegalStateException("bank.instance-id must be set");
        }
        return new LocalIdentity(properties.getInstanceId(), new KeyPairLoader(properties.getKeys()).load());
    }
}
