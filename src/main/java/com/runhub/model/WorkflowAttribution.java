package com.runhub.model;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Links one payment/conversion event to exactly one workflow run.
 *
 * paymentEventId is unique: the first attribution of a payment wins and the
 * row is never changed afterwards, so revenue is never counted for two runs.
 * A run may still collect many attributions from distinct payments.
 */
@Entity
@Table(name = "workflow_attributions", uniqueConstraints = {
    @UniqueConstraint(name = "uq_workflow_attributions_payment",
            columnNames = {"payment_event_id"})
})
@Getter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowAttribution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private String projectId;

    @Column(name = "workflow_run_id", nullable = false, updatable = false)
    private UUID workflowRunId;

    @Column(name = "payment_event_id", nullable = false, updatable = false)
    private String paymentEventId;

    @Column(name = "attributed_at", nullable = false, updatable = false)
    private Instant attributedAt;

    /** Tag of the {@link AttributionModel} that produced this row, e.g. "last_touch_48h". */
    @Column(name = "attribution_model", nullable = false, updatable = false)
    private String attributionModel;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_method", nullable = false, updatable = false)
    private MatchMethod matchMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AttributionConfidence confidence;

    @Column(name = "amount_cents", nullable = false, updatable = false)
    private long amountCents;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;
}
