package com.runhub.dto;

import lombok.*;

import java.util.List;

/**
 * Envelope published by webhook ingestion on the payments topic.
 *
 * Example JSON:
 * {
 *   "deliveryId": "dlv-9f2c",
 *   "payment": { "paymentEventId": "evt_pay_551", "projectId": "proj_42", ... },
 *   "candidates": [ { "runId": "...", "matchMethod": "email" } ],
 *   "retryCount": 0
 * }
 *
 * - deliveryId: identifies one delivery attempt; the same payment may arrive
 *               under several delivery ids, which attribution absorbs
 * - retryCount: incremented each time the DLQ re-publishes the message
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class PaymentEventMessage {

    private String deliveryId;
    private PaymentEvent payment;
    private List<MatchCandidate> candidates;
    private int retryCount;
}
