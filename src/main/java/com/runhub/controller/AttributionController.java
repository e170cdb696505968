package com.runhub.controller;

import com.runhub.dto.AttributionRequest;
import com.runhub.dto.AttributionResponse;
import com.runhub.service.WorkflowExecutionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST endpoint for attributing a payment synchronously (alternative to Kafka).
 *
 * POST /api/attributions
 * {
 *   "payment": {"paymentEventId": "evt_pay_551", "projectId": "proj_42",
 *               "amountCents": 4900, "currency": "USD"},
 *   "candidates": [{"runId": "...", "matchMethod": "email"}]
 * }
 * → 200 with the payment's attribution (new or the one claimed earlier), 204 when no run qualifies
 */
@RestController
@RequestMapping("/api/attributions")
@RequiredArgsConstructor
public class AttributionController {

    private final WorkflowExecutionService executionService;

    @PostMapping
    public ResponseEntity<AttributionResponse> attribute(@Valid @RequestBody AttributionRequest request) {
        return executionService.attributeOutcome(request.getPayment(), request.getCandidates())
                .map(executionService::toResponse)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
