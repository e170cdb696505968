package com.runhub.repository;

import com.runhub.model.WorkflowAttribution;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Database access for WorkflowAttribution entities.
 * Rows are only ever inserted; there is deliberately no update path here.
 */
public interface WorkflowAttributionRepository extends JpaRepository<WorkflowAttribution, UUID> {

    Optional<WorkflowAttribution> findByPaymentEventId(String paymentEventId);

    List<WorkflowAttribution> findByWorkflowRunId(UUID workflowRunId);

    // Outcome summaries for a page of runs
    List<WorkflowAttribution> findByWorkflowRunIdIn(Collection<UUID> workflowRunIds);
}
