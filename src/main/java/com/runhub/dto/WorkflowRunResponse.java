package com.runhub.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowRunResponse {
    private UUID id;
    private String projectId;
    private String actionId;
    private String idempotencyKey;
    private String triggeredBy;
    private Map<String, Object> params;
    private Instant clientRequestedAt;
    private Integer recipientCountEstimate;
    private Instant createdAt;
    // Only set on start responses
    private Boolean deduplicated;
    // Absent until the run has at least one attributed conversion
    private RunOutcome outcome;
}
