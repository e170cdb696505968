package com.runhub.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runhub.config.RunHubProperties;
import com.runhub.dto.PaymentEventMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Consumes failed payment messages from the DLQ and re-publishes them.
 *
 * FLOW:
 *   runhub.payments.dlq → parse envelope (originalMessage, retryCount, error)
 *                               ↓
 *                      retryCount < maxRetries?
 *          ┌──── YES ───────────┴─────────── NO ────┐
 *          ↓                                         ↓
 *    wait baseDelayMs * 5^retryCount          runhub.payments.dlq.dead
 *    re-publish to runhub.payments with retryCount + 1
 *
 * Re-publishing is safe: attribution is keyed by payment event, so a payment that
 * was in fact attributed before the failure resolves to the same row.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DlqRetryConsumer {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ObjectMapper objectMapper;
    private final RunHubProperties properties;

    @KafkaListener(topics = "${runhub.topics.dlq:runhub.payments.dlq}", groupId = "runhub-dlq-processor")
    public void onDlqMessage(String message) {
        try {
            Map<String, Object> envelope = objectMapper.readValue(message, new TypeReference<>() {});

            if (envelope.containsKey("rawMessage")) {
                log.warn("Unparseable payment message in DLQ, moving to permanent DLQ: {}", envelope.get("error"));
                deadLetterQueueService.sendToPermanentDlq(message, "Unparseable payment message, cannot retry");
                return;
            }

            Object rc = envelope.getOrDefault("retryCount", 0);
            int retryCount = rc instanceof Number ? ((Number) rc).intValue() : 0;

            if (!deadLetterQueueService.isRetryable(retryCount)) {
                log.error("CRITICAL: Payment message exhausted all retries (count={}), moving to permanent DLQ",
                        retryCount);
                deadLetterQueueService.sendToPermanentDlq(message, "Max retries exceeded: " + retryCount);
                return;
            }

            Object original = envelope.get("originalMessage");
            if (original == null) {
                log.error("DLQ message missing originalMessage field, parking permanently");
                deadLetterQueueService.sendToPermanentDlq(message, "Missing originalMessage field");
                return;
            }

            PaymentEventMessage payment = objectMapper.convertValue(original, PaymentEventMessage.class);

            long delayMs = calculateBackoff(retryCount);
            log.info("Retrying payment message: deliveryId={}, attempt={}, backoff={}ms",
                    payment.getDeliveryId(), retryCount + 1, delayMs);
            Thread.sleep(delayMs);

            payment.setRetryCount(retryCount + 1);

            String topic = properties.getTopics().getPayments();
            kafkaTemplate.send(topic, payment.getDeliveryId(), objectMapper.writeValueAsString(payment));
            log.info("Re-published payment message to {}: deliveryId={}, attempt={}",
                    topic, payment.getDeliveryId(), retryCount + 1);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("DLQ retry interrupted: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Failed to process DLQ message: {}", e.getMessage(), e);
        }
    }

    long calculateBackoff(int retryCount) {
        return properties.getDlq().getBaseDelayMs() * (long) Math.pow(5, retryCount);
    }
}
