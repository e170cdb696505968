package com.runhub.repository;

import com.runhub.model.SendStatus;
import com.runhub.model.WorkflowSend;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Database access for WorkflowSend entities.
 *
 * findByProjectIdAndActionIdAndStatusAndSentAtAfterAndEmailIn(p, a, SENT, since, emails)
 * → SELECT * FROM workflow_sends
 *   WHERE project_id = ? AND action_id = ? AND status = 'SENT' AND sent_at > ? AND email IN (...)
 *
 * That is the cooldown lookup: every row returned names a recipient still cooling down.
 */
public interface WorkflowSendRepository extends JpaRepository<WorkflowSend, UUID> {

    Optional<WorkflowSend> findByWorkflowRunIdAndEmail(UUID workflowRunId, String email);

    List<WorkflowSend> findByProjectIdAndActionIdAndStatusAndSentAtAfterAndEmailIn(
            String projectId, String actionId, SendStatus status, Instant since, Collection<String> emails);
}
