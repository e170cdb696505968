package com.runhub.dto;

import com.runhub.model.SendStatus;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowSendResponse {
    private UUID id;
    private UUID workflowRunId;
    private String actionId;
    private String email;
    private SendStatus status;
    private Instant sentAt;
}
