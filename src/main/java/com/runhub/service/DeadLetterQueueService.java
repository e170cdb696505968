package com.runhub.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.runhub.config.RunHubProperties;
import com.runhub.dto.PaymentEventMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Dead-letter handling for payment messages that could not be attributed.
 *
 * DLQ envelope (runhub.payments.dlq):
 *   { "originalMessage": {...}, "error": "...", "retryCount": 1, "timestamp": 1767225600000 }
 * Raw envelope, when the message itself could not be parsed:
 *   { "rawMessage": "...", "error": "...", "retryCount": 0, "timestamp": ... }
 *
 * Publishing to the DLQ must never throw back into a listener, so failures
 * here are logged as CRITICAL and dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueueService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final RunHubProperties properties;
    private final Clock clock;

    public void sendToDlq(PaymentEventMessage message, String errorMessage, int retryCount) {
        try {
            Map<String, Object> envelope = new HashMap<>();
            envelope.put("originalMessage", message);
            envelope.put("error", errorMessage);
            envelope.put("retryCount", retryCount);
            envelope.put("timestamp", clock.millis());

            kafkaTemplate.send(properties.getTopics().getDlq(), message.getDeliveryId(),
                    objectMapper.writeValueAsString(envelope));
            log.info("Payment message sent to DLQ: deliveryId={}, retryCount={}, error={}",
                    message.getDeliveryId(), retryCount, errorMessage);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to send payment message to DLQ: {}", e.getMessage(), e);
        }
    }

    public void sendRawToDlq(String rawMessage, String errorMessage) {
        try {
            Map<String, Object> envelope = new HashMap<>();
            envelope.put("rawMessage", rawMessage);
            envelope.put("error", errorMessage);
            envelope.put("retryCount", 0);
            envelope.put("timestamp", clock.millis());

            kafkaTemplate.send(properties.getTopics().getDlq(), objectMapper.writeValueAsString(envelope));
            log.info("Unparseable payment message sent to DLQ: error={}", errorMessage);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to send raw payment message to DLQ: {}", e.getMessage(), e);
        }
    }

    /**
     * Parks a DLQ message on the permanent topic. Nothing consumes it automatically;
     * it needs manual investigation.
     */
    public void sendToPermanentDlq(String dlqMessage, String reason) {
        try {
            Map<String, Object> envelope = new HashMap<>();
            envelope.put("originalDlqMessage", dlqMessage);
            envelope.put("reason", reason);
            envelope.put("timestamp", clock.millis());

            kafkaTemplate.send(properties.getTopics().getDlqDead(), objectMapper.writeValueAsString(envelope));
            log.error("CRITICAL: Payment message moved to permanent DLQ: reason={}", reason);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to send to permanent DLQ: {}", e.getMessage(), e);
        }
    }

    public boolean isRetryable(int retryCount) {
        return retryCount < properties.getDlq().getMaxRetries();
    }
}
