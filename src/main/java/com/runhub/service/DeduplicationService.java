package com.runhub.service;

import com.runhub.config.RunHubProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Drops repeated webhook deliveries before they reach the database, using Redis.
 *
 * HOW IT WORKS:
 *   1. A payment message arrives → isProcessed(deliveryId) checks "runhub:delivery:{deliveryId}"
 *   2. Key present → delivery already handled, skip it
 *   3. Key absent  → attribute the payment
 *   4. Only after attribution returns → markProcessed(deliveryId) sets the key with the TTL
 *
 * The key is written after the work, never before it: a consumer that dies mid-attribution
 * leaves no key behind, so Kafka's redelivery of the same delivery id is processed again.
 * Two concurrent deliveries can both pass the check; the unique payment_event_id on
 * workflow_attributions absorbs the second one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeduplicationService {

    private static final String DELIVERY_PREFIX = "runhub:delivery:";

    private final StringRedisTemplate redisTemplate;
    private final RunHubProperties properties;

    public boolean isProcessed(String deliveryId) {
        if (deliveryId == null || deliveryId.isBlank()) {
            return false; // nothing to key on, let attribution idempotency handle it
        }

        if (Boolean.TRUE.equals(redisTemplate.hasKey(DELIVERY_PREFIX + deliveryId))) {
            log.warn("Duplicate payment delivery detected: deliveryId={}", deliveryId);
            return true;
        }
        return false;
    }

    public void markProcessed(String deliveryId) {
        if (deliveryId == null || deliveryId.isBlank()) {
            return;
        }
        redisTemplate.opsForValue().set(DELIVERY_PREFIX + deliveryId, "1", properties.getDedup().getTtl());
    }
}
