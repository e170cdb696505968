package com.runhub.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.*;

import java.time.Instant;
import java.util.Map;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StartRunRequest {

    @NotBlank(message = "actionId is required")
    private String actionId;

    @NotBlank(message = "idempotencyKey is required")
    private String idempotencyKey;

    @NotBlank(message = "triggeredBy is required")
    private String triggeredBy;

    private Map<String, Object> params;

    private String locale;

    private Instant clientRequestedAt;

    @PositiveOrZero(message = "recipientCountEstimate must not be negative")
    private Integer recipientCountEstimate;
}
