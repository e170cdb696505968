package com.runhub.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralizes topic names, retry settings and workflow defaults.
 *
 * Bound from application.yml under "runhub" prefix:
 *   runhub:
 *     topics:
 *       payments: runhub.payments
 *       dlq: runhub.payments.dlq
 *       dlq-dead: runhub.payments.dlq.dead
 *     dlq:
 *       max-retries: 3
 *       base-delay-ms: 5000
 *     dedup:
 *       ttl: 24h
 *     recipients:
 *       default-cooldown: 24h
 *     runs:
 *       default-page-size: 20
 *       max-page-size: 100
 */
@Component
@ConfigurationProperties(prefix = "runhub")
@Getter
@Setter
public class RunHubProperties {

    private Topics topics = new Topics();
    private Dlq dlq = new Dlq();
    private Dedup dedup = new Dedup();
    private Recipients recipients = new Recipients();
    private Runs runs = new Runs();

    @Getter
    @Setter
    public static class Topics {
        private String payments = "runhub.payments";
        private String dlq = "runhub.payments.dlq";
        private String dlqDead = "runhub.payments.dlq.dead";
    }

    @Getter
    @Setter
    public static class Dlq {
        private int maxRetries = 3;
        private long baseDelayMs = 5000;
    }

    @Getter
    @Setter
    public static class Dedup {
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Recipients {
        /** Used when a caller does not pass an explicit cooldown window. */
        private Duration defaultCooldown = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Runs {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
    }
}
