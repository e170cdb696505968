package com.runhub.controller;

import com.runhub.dto.*;
import com.runhub.model.WorkflowSend;
import com.runhub.service.WorkflowExecutionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * REST endpoints for the run lifecycle.
 *
 * POST /api/projects/{projectId}/runs
 * {
 *   "actionId": "recover_abandoned",
 *   "idempotencyKey": "cart-7781",
 *   "triggeredBy": "user_9",
 *   "params": {"segmentation": "recent_7d"},
 *   "locale": "ar"
 * }
 * → 201 with the new run, or 200 with the existing one and "deduplicated": true
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class WorkflowRunController {

    private final WorkflowExecutionService executionService;

    @PostMapping("/projects/{projectId}/runs")
    public ResponseEntity<WorkflowRunResponse> startRun(
            @PathVariable String projectId, @Valid @RequestBody StartRunRequest request) {
        RunContext context = RunContext.builder()
                .triggeredBy(request.getTriggeredBy())
                .params(request.getParams())
                .locale(request.getLocale())
                .clientRequestedAt(request.getClientRequestedAt())
                .recipientCountEstimate(request.getRecipientCountEstimate())
                .build();

        StartRunResult result = executionService.startRun(
                projectId, request.getActionId(), request.getIdempotencyKey(), context);

        WorkflowRunResponse body = executionService.toResponse(result.getRun(), null, result.isDeduplicated());
        HttpStatus status = result.isDeduplicated() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(body);
    }

    @GetMapping("/projects/{projectId}/runs")
    public ResponseEntity<RunPage> listRuns(
            @PathVariable String projectId,
            @RequestParam(required = false) String actionId,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(executionService.listRuns(projectId, actionId, cursor, limit));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<WorkflowRunResponse> getRun(@PathVariable UUID runId) {
        return ResponseEntity.ok(executionService.getRun(runId));
    }

    @PostMapping("/projects/{projectId}/recipients")
    public ResponseEntity<RecipientsResponse> buildRecipients(
            @PathVariable String projectId, @Valid @RequestBody RecipientsRequest request) {
        Duration cooldown = request.getCooldownHours() == null
                ? null
                : Duration.ofHours(request.getCooldownHours());

        List<String> eligible = executionService.buildRecipients(
                projectId, request.getActionId(), request.getCandidates(), cooldown);
        // Blanks and case-duplicates are not cooldown exclusions
        int distinct = WorkflowExecutionService.normalizeCandidates(request.getCandidates()).size();

        return ResponseEntity.ok(RecipientsResponse.builder()
                .actionId(request.getActionId())
                .eligible(eligible)
                .excludedCount(distinct - eligible.size())
                .build());
    }

    @PostMapping("/runs/{runId}/sends")
    public ResponseEntity<WorkflowSendResponse> recordSend(
            @PathVariable UUID runId, @Valid @RequestBody RecordSendRequest request) {
        WorkflowSend send = executionService.recordSend(runId, request.getEmail(), request.getStatus());
        return ResponseEntity.ok(executionService.toResponse(send));
    }
}
