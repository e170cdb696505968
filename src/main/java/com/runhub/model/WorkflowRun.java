package com.runhub.model;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One attempted execution of a workflow action for a project.
 *
 * A run is identified for replay purposes by (projectId, actionId, idempotencyKey):
 * a second start with the same triple returns this row instead of creating another.
 * Rows are never updated after insert.
 *
 * Example:
 *   projectId       = "proj_42"
 *   actionId        = "recover_abandoned"
 *   idempotencyKey  = "cart-7781"
 *   triggeredBy     = "user_9"
 *   params          = {"locale": "ar"}
 */
@Entity
@Table(name = "workflow_runs", uniqueConstraints = {
    @UniqueConstraint(name = "uq_workflow_runs_idempotency",
            columnNames = {"project_id", "action_id", "idempotency_key"})
})
@Getter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private String projectId;

    @Column(name = "action_id", nullable = false, updatable = false)
    private String actionId;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Column(name = "triggered_by", nullable = false, updatable = false)
    private String triggeredBy;

    /** JSON object with the caller's run parameters. */
    @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
    private String params;

    @Column(name = "client_requested_at", updatable = false)
    private Instant clientRequestedAt;

    @Column(name = "recipient_count_estimate", updatable = false)
    private Integer recipientCountEstimate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
