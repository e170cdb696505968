package com.runhub.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.runhub.dto.PaymentEventMessage;
import com.runhub.model.WorkflowAttribution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Kafka consumer for payment events published by webhook ingestion.
 *
 * FLOW:
 *   runhub.payments → parse PaymentEventMessage
 *                          ↓
 *                    delivery seen before? → skip
 *                          ↓
 *                    attributeOutcome(payment, candidates) → mark delivery processed
 *                          ↓ (failure)
 *          invalid payment → runhub.payments.dlq.dead (no retry)
 *          anything else   → runhub.payments.dlq (retried)
 *
 * Consumer group "runhub-attribution" ensures each delivery is handled by one instance.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentEventListener {

    private final WorkflowExecutionService executionService;
    private final DeduplicationService deduplicationService;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = "${runhub.topics.payments:runhub.payments}", groupId = "runhub-attribution")
    public void onPaymentEvent(String message) {
        PaymentEventMessage event;
        try {
            event = objectMapper.readValue(message, PaymentEventMessage.class);
        } catch (Exception e) {
            log.error("Failed to parse payment message: {}", e.getMessage(), e);
            deadLetterQueueService.sendRawToDlq(message, e.getMessage());
            return;
        }

        if (event.getPayment() == null) {
            deadLetterQueueService.sendRawToDlq(message, "Missing payment");
            return;
        }

        if (deduplicationService.isProcessed(event.getDeliveryId())) {
            log.info("Skipping duplicate payment delivery: {}", event.getDeliveryId());
            return;
        }

        try {
            Optional<WorkflowAttribution> attribution =
                    executionService.attributeOutcome(event.getPayment(), event.getCandidates());
            deduplicationService.markProcessed(event.getDeliveryId());
            log.info("Payment delivery handled: deliveryId={}, paymentEventId={}, runId={}",
                    event.getDeliveryId(), event.getPayment().getPaymentEventId(),
                    attribution.map(WorkflowAttribution::getWorkflowRunId).orElse(null));
        } catch (IllegalArgumentException e) {
            // Invalid payment data fails the same way on every retry
            log.error("Rejected invalid payment delivery {}: {}", event.getDeliveryId(), e.getMessage());
            deadLetterQueueService.sendToPermanentDlq(message, "Invalid payment: " + e.getMessage());
        } catch (Exception e) {
            log.error("Failed to attribute payment delivery {}: {}", event.getDeliveryId(), e.getMessage(), e);
            deadLetterQueueService.sendToDlq(event, e.getMessage(), event.getRetryCount());
        }
    }
}
