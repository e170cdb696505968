package com.runhub.dto;

import com.runhub.model.AttributionConfidence;
import com.runhub.model.MatchMethod;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AttributionResponse {
    private UUID id;
    private String projectId;
    private UUID workflowRunId;
    private String paymentEventId;
    private Instant attributedAt;
    private String model;
    private MatchMethod matchMethod;
    private AttributionConfidence confidence;
    private long amountCents;
    private String currency;
}
