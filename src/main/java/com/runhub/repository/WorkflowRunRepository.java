package com.runhub.repository;

import com.runhub.model.WorkflowRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Database access for WorkflowRun entities.
 *
 * findByProjectIdAndActionIdAndIdempotencyKey("p1", "recover_abandoned", "k1")
 * → SELECT * FROM workflow_runs WHERE project_id = ? AND action_id = ? AND idempotency_key = ?
 *
 * The listing queries are keyset-paginated on (created_at, id), newest first, so runs
 * sharing a timestamp are never skipped at a page boundary. Callers pass a Pageable
 * sized one larger than the page to detect "has more".
 */
public interface WorkflowRunRepository extends JpaRepository<WorkflowRun, UUID> {

    Optional<WorkflowRun> findByProjectIdAndActionIdAndIdempotencyKey(
            String projectId, String actionId, String idempotencyKey);

    List<WorkflowRun> findByProjectIdOrderByCreatedAtDescIdDesc(String projectId, Pageable page);

    List<WorkflowRun> findByProjectIdAndActionIdOrderByCreatedAtDescIdDesc(
            String projectId, String actionId, Pageable page);

    @Query(value = "SELECT * FROM workflow_runs "
            + "WHERE project_id = :projectId AND (created_at, id) < (:createdAt, :id) "
            + "ORDER BY created_at DESC, id DESC",
            nativeQuery = true)
    List<WorkflowRun> findPageBefore(@Param("projectId") String projectId,
                                     @Param("createdAt") Instant createdAt,
                                     @Param("id") UUID id,
                                     Pageable page);

    @Query(value = "SELECT * FROM workflow_runs "
            + "WHERE project_id = :projectId AND action_id = :actionId "
            + "AND (created_at, id) < (:createdAt, :id) "
            + "ORDER BY created_at DESC, id DESC",
            nativeQuery = true)
    List<WorkflowRun> findPageBeforeForAction(@Param("projectId") String projectId,
                                              @Param("actionId") String actionId,
                                              @Param("createdAt") Instant createdAt,
                                              @Param("id") UUID id,
                                              Pageable page);
}
