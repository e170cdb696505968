package com.runhub.model;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One recipient notified as part of a run.
 *
 * Unique per (run, email). A retried run updates status and sentAt on the
 * existing row. The (project, action, email, sentAt) columns double as the
 * cooldown lookup source for later runs of the same action.
 */
@Entity
@Table(name = "workflow_sends", uniqueConstraints = {
    @UniqueConstraint(name = "uq_workflow_sends_run_email",
            columnNames = {"workflow_run_id", "email"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowSend {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_run_id", nullable = false, updatable = false)
    private UUID workflowRunId;

    @Column(name = "project_id", nullable = false, updatable = false)
    private String projectId;

    @Column(name = "action_id", nullable = false, updatable = false)
    private String actionId;

    // Always lower-cased
    @Column(nullable = false, updatable = false)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SendStatus status;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;
}
