package com.flagship.toy_banking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings of this bank instance.
 *
 * Bound from the {@code bank.*} namespace of application.yml; every value can be
 * overridden from the environment (BANK_SWIFT, REGISTRY_BASE_URL, ...).
 */
@ConfigurationProperties(prefix = "bank")
@Getter
@Setter
public class BankProperties {

    /**
     * Swift code of this instance. Used as the instance id on the wire and in the registry.
     */
    private String instanceId;

    private String name;

    private String region;

    private String country;

    /**
     * Public base URL other instances use to reach the protocol endpoint.
     */
    private String baseUrl;

    private Keys keys = new Keys();

    private Registry registry = new Registry();

    private Protocol protocol = new Protocol();

    private Recovery recovery = new Recovery();

    @Getter
    @Setter
    public static class Keys {
        private String privateKeyPath;
        private String publicKeyPath;
        private boolean generateIfMissing = true;
    }

    @Getter
    @Setter
    public static class Registry {
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(5);
        private Duration cacheTtl = Duration.ofMinutes(5);
        private boolean registerOnStartup = true;
    }

    @Getter
    @Setter
    public static class Protocol {
        /**
         * Upper bound for a single request/reply exchange with a participant.
         */
        private Duration requestTimeout = Duration.ofSeconds(2);

        /**
         * Total number of sends of one message, first attempt included.
         */
        private int maxAttempts = 3;

        private Duration retryBackoff = Duration.ofMillis(200);

        /**
         * How long a destination keeps a credit reservation without a commit.
         */
        private Duration reservationTtl = Duration.ofSeconds(30);

        private Duration processedMessageRetention = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class Recovery {
        /**
         * Non-terminal transfers untouched for longer than this are resolved by the recovery sweep.
         */
        private Duration staleAfter = Duration.ofSeconds(60);

        private int batchSize = 50;
    }
}
