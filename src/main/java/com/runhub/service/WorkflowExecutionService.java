package com.runhub.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runhub.config.RunHubProperties;
import com.runhub.dto.*;
import com.runhub.model.*;
import com.runhub.repository.WorkflowAttributionRepository;
import com.runhub.repository.WorkflowRunRepository;
import com.runhub.repository.WorkflowSendRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Owns the workflow run lifecycle: start, dedupe, record sends, attribute outcomes.
 *
 * FLOW:
 *   1. A trigger calls startRun(project, action, key) → new run, or the existing one on replay
 *   2. The caller asks buildRecipients(...) → candidates minus anyone in cooldown
 *   3. The caller delivers, then recordSend(run, email, status) per recipient
 *   4. A payment arrives → attributeOutcome(payment, candidates) credits at most one run
 *
 * Steps 1, 3 and 4 are idempotent through {@link IdempotentInsert}: each one is a single
 * insert-or-read-existing on a unique key, so callers may retry any of them freely.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowExecutionService {

    private static final AttributionModel MODEL = AttributionModel.LAST_TOUCH_48H;
    private static final Pattern CURRENCY = Pattern.compile("^[A-Za-z]{3}$");
    private static final char CURSOR_SEPARATOR = '_';

    private final WorkflowRunRepository runRepository;
    private final WorkflowSendRepository sendRepository;
    private final WorkflowAttributionRepository attributionRepository;
    private final IdempotentInsert idempotentInsert;
    private final ObjectMapper objectMapper;
    private final RunHubProperties properties;
    private final Clock clock;

    // --- Runs ---

    public StartRunResult startRun(String projectId, String actionId, String idempotencyKey, RunContext context) {
        requireText(projectId, "projectId");
        requireText(actionId, "actionId");
        requireText(idempotencyKey, "idempotencyKey");
        RunContext ctx = context != null ? context : new RunContext();

        IdempotentInsert.Result<WorkflowRun> result = idempotentInsert.insertOrFetch(
                () -> runRepository.saveAndFlush(WorkflowRun.builder()
                        .projectId(projectId)
                        .actionId(actionId)
                        .idempotencyKey(idempotencyKey)
                        .triggeredBy(ctx.getTriggeredBy() != null ? ctx.getTriggeredBy() : "system")
                        .params(writeParams(ctx))
                        .clientRequestedAt(ctx.getClientRequestedAt())
                        .recipientCountEstimate(ctx.getRecipientCountEstimate())
                        .createdAt(clock.instant())
                        .build()),
                () -> runRepository.findByProjectIdAndActionIdAndIdempotencyKey(
                        projectId, actionId, idempotencyKey));

        WorkflowRun run = result.getValue();
        log.info("Workflow run started: runId={}, projectId={}, actionId={}, deduplicated={}",
                run.getId(), projectId, actionId, !result.isInserted());
        return new StartRunResult(run, !result.isInserted());
    }

    @Transactional(readOnly = true)
    public WorkflowRun getRunEntity(UUID runId) {
        return runRepository.findById(runId)
                .orElseThrow(() -> new EntityNotFoundException("Workflow run not found: " + runId));
    }

    @Transactional(readOnly = true)
    public WorkflowRunResponse getRun(UUID runId) {
        WorkflowRun run = getRunEntity(runId);
        return toResponse(run, summarize(attributionRepository.findByWorkflowRunId(runId)), null);
    }

    @Transactional(readOnly = true)
    public RunPage listRuns(String projectId, String actionId, String cursor, Integer limit) {
        requireText(projectId, "projectId");
        int pageSize = pageSize(limit);
        PageRequest page = PageRequest.of(0, pageSize + 1); // one extra to detect hasMore
        Cursor before = parseCursor(cursor);
        boolean byAction = actionId != null && !actionId.isBlank();

        List<WorkflowRun> rows;
        if (byAction && before != null) {
            rows = runRepository.findPageBeforeForAction(
                    projectId, actionId, before.createdAt, before.id, page);
        } else if (byAction) {
            rows = runRepository.findByProjectIdAndActionIdOrderByCreatedAtDescIdDesc(projectId, actionId, page);
        } else if (before != null) {
            rows = runRepository.findPageBefore(projectId, before.createdAt, before.id, page);
        } else {
            rows = runRepository.findByProjectIdOrderByCreatedAtDescIdDesc(projectId, page);
        }

        boolean hasMore = rows.size() > pageSize;
        List<WorkflowRun> pageRows = hasMore ? rows.subList(0, pageSize) : rows;

        Map<UUID, List<WorkflowAttribution>> byRun = pageRows.isEmpty()
                ? Map.of()
                : attributionRepository.findByWorkflowRunIdIn(
                                pageRows.stream().map(WorkflowRun::getId).collect(Collectors.toList()))
                        .stream()
                        .collect(Collectors.groupingBy(WorkflowAttribution::getWorkflowRunId));

        List<WorkflowRunResponse> runs = pageRows.stream()
                .map(r -> toResponse(r, summarize(byRun.getOrDefault(r.getId(), List.of())), null))
                .collect(Collectors.toList());

        return RunPage.builder()
                .runs(runs)
                .nextCursor(hasMore ? formatCursor(pageRows.get(pageRows.size() - 1)) : null)
                .build();
    }

    // --- Recipients ---

    /**
     * Returns the candidates not contacted for (project, action) within the cooldown window.
     * Candidates go through {@link #normalizeCandidates} first. A zero window disables the
     * cooldown, a null window uses the configured default.
     */
    @Transactional(readOnly = true)
    public List<String> buildRecipients(String projectId, String actionId,
                                        List<String> candidateEmails, Duration cooldownWindow) {
        requireText(projectId, "projectId");
        requireText(actionId, "actionId");
        Duration window = cooldownWindow != null
                ? cooldownWindow
                : properties.getRecipients().getDefaultCooldown();
        if (window.isNegative()) {
            throw new IllegalArgumentException("cooldownWindow must not be negative: " + window);
        }

        List<String> normalized = normalizeCandidates(candidateEmails);
        if (normalized.isEmpty() || window.isZero()) {
            return normalized;
        }

        Instant since = clock.instant().minus(window);
        Set<String> cooling = sendRepository
                .findByProjectIdAndActionIdAndStatusAndSentAtAfterAndEmailIn(
                        projectId, actionId, SendStatus.SENT, since, normalized)
                .stream()
                .map(WorkflowSend::getEmail)
                .collect(Collectors.toSet());

        List<String> eligible = normalized.stream()
                .filter(email -> !cooling.contains(email))
                .collect(Collectors.toList());

        log.info("Recipients built: projectId={}, actionId={}, candidates={}, eligible={}, cooldown={}",
                projectId, actionId, normalized.size(), eligible.size(), window);
        return eligible;
    }

    /**
     * Lower-cases and de-duplicates candidate emails, dropping nulls and blanks.
     * First occurrence wins; relative order is preserved.
     */
    public static List<String> normalizeCandidates(List<String> candidateEmails) {
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        if (candidateEmails != null) {
            for (String email : candidateEmails) {
                if (email != null && !email.isBlank()) {
                    normalized.add(normalizeEmail(email));
                }
            }
        }
        return new ArrayList<>(normalized);
    }

    // --- Sends ---

    public WorkflowSend recordSend(UUID runId, String email, SendStatus status) {
        return recordSend(getRunEntity(runId), email, status);
    }

    /**
     * Upserts the (run, email) send row. A retry of the same pair updates status and
     * sentAt on the existing row instead of adding one.
     */
    public WorkflowSend recordSend(WorkflowRun run, String email, SendStatus status) {
        Objects.requireNonNull(run, "run");
        requireText(email, "email");
        Objects.requireNonNull(status, "status");
        String normalized = normalizeEmail(email);

        IdempotentInsert.Result<WorkflowSend> result = idempotentInsert.upsert(
                () -> sendRepository.saveAndFlush(WorkflowSend.builder()
                        .workflowRunId(run.getId())
                        .projectId(run.getProjectId())
                        .actionId(run.getActionId())
                        .email(normalized)
                        .status(status)
                        .sentAt(clock.instant())
                        .build()),
                () -> sendRepository.findByWorkflowRunIdAndEmail(run.getId(), normalized),
                existing -> {
                    existing.setStatus(status);
                    existing.setSentAt(clock.instant());
                    return sendRepository.save(existing);
                });

        log.debug("Send recorded: runId={}, email={}, status={}, inserted={}",
                run.getId(), normalized, status, result.isInserted());
        return result.getValue();
    }

    // --- Attribution ---

    /**
     * Credits a payment to at most one run.
     *
     * An existing attribution for the payment is returned untouched (first claim wins).
     * Otherwise candidates are narrowed to runs of the payment's project created within the
     * model's lookback before the payment; the strongest match method wins and, among equally
     * strong matches, the most recent run. Empty when nothing qualifies.
     */
    public Optional<WorkflowAttribution> attributeOutcome(PaymentEvent payment, List<MatchCandidate> candidates) {
        Objects.requireNonNull(payment, "payment");
        requireText(payment.getPaymentEventId(), "paymentEventId");
        requireText(payment.getProjectId(), "projectId");
        requireText(payment.getCurrency(), "currency");
        if (!CURRENCY.matcher(payment.getCurrency().trim()).matches()) {
            throw new IllegalArgumentException("currency must be a three-letter ISO-4217 code: " + payment.getCurrency());
        }
        if (payment.getAmountCents() == null || payment.getAmountCents() < 0) {
            throw new IllegalArgumentException("amountCents must be a non-negative amount");
        }
        String paymentEventId = payment.getPaymentEventId();

        Optional<WorkflowAttribution> prior = attributionRepository.findByPaymentEventId(paymentEventId);
        if (prior.isPresent()) {
            log.warn("Duplicate attribution claim: paymentEventId={} already credited to runId={}",
                    paymentEventId, prior.get().getWorkflowRunId());
            return prior;
        }

        Optional<Selected> winner = selectRun(payment, candidates);
        if (winner.isEmpty()) {
            log.info("No eligible run for payment: paymentEventId={}, projectId={}, candidates={}",
                    paymentEventId, payment.getProjectId(), candidates == null ? 0 : candidates.size());
            return Optional.empty();
        }

        WorkflowRun run = winner.get().run;
        MatchMethod method = winner.get().method;
        IdempotentInsert.Result<WorkflowAttribution> result = idempotentInsert.insertOrFetch(
                () -> attributionRepository.saveAndFlush(WorkflowAttribution.builder()
                        .projectId(payment.getProjectId())
                        .workflowRunId(run.getId())
                        .paymentEventId(paymentEventId)
                        .attributedAt(clock.instant())
                        .attributionModel(MODEL.getTag())
                        .matchMethod(method)
                        .confidence(method.confidence())
                        .amountCents(payment.getAmountCents())
                        .currency(payment.getCurrency().trim().toUpperCase(Locale.ROOT))
                        .build()),
                () -> attributionRepository.findByPaymentEventId(paymentEventId));

        if (result.isInserted()) {
            log.info("Payment attributed: paymentEventId={}, runId={}, matchMethod={}, confidence={}",
                    paymentEventId, run.getId(), method, method.confidence());
        } else {
            log.warn("Duplicate attribution claim: paymentEventId={} already credited to runId={}",
                    paymentEventId, result.getValue().getWorkflowRunId());
        }
        return Optional.of(result.getValue());
    }

    private Optional<Selected> selectRun(PaymentEvent payment, List<MatchCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        Set<UUID> ids = candidates.stream()
                .filter(c -> c != null && c.getRunId() != null)
                .map(MatchCandidate::getRunId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<UUID, WorkflowRun> runs = runRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(WorkflowRun::getId, r -> r));

        Instant paidAt = payment.getOccurredAt() != null ? payment.getOccurredAt() : clock.instant();
        Instant earliest = paidAt.minus(MODEL.getLookback());

        Selected best = null;
        for (MatchCandidate candidate : candidates) {
            if (candidate == null || candidate.getMatchMethod() == null) {
                continue;
            }
            WorkflowRun run = runs.get(candidate.getRunId());
            if (run == null
                    || !run.getProjectId().equals(payment.getProjectId())
                    || run.getCreatedAt().isAfter(paidAt)
                    || run.getCreatedAt().isBefore(earliest)) {
                continue;
            }
            Selected next = new Selected(run, candidate.getMatchMethod());
            if (best == null || next.beats(best)) {
                best = next;
            }
        }
        return Optional.ofNullable(best);
    }

    private static final class Selected {
        final WorkflowRun run;
        final MatchMethod method;

        Selected(WorkflowRun run, MatchMethod method) {
            this.run = run;
            this.method = method;
        }

        boolean beats(Selected other) {
            if (method.confidence() != other.method.confidence()) {
                return method.confidence().isStrongerThan(other.method.confidence());
            }
            // Equal confidence: last touch wins
            return run.getCreatedAt().isAfter(other.run.getCreatedAt());
        }
    }

    // --- Mapping helpers ---

    public WorkflowRunResponse toResponse(WorkflowRun run, RunOutcome outcome, Boolean deduplicated) {
        return WorkflowRunResponse.builder()
                .id(run.getId())
                .projectId(run.getProjectId())
                .actionId(run.getActionId())
                .idempotencyKey(run.getIdempotencyKey())
                .triggeredBy(run.getTriggeredBy())
                .params(readParams(run.getParams()))
                .clientRequestedAt(run.getClientRequestedAt())
                .recipientCountEstimate(run.getRecipientCountEstimate())
                .createdAt(run.getCreatedAt())
                .deduplicated(deduplicated)
                .outcome(outcome)
                .build();
    }

    public AttributionResponse toResponse(WorkflowAttribution a) {
        return AttributionResponse.builder()
                .id(a.getId())
                .projectId(a.getProjectId())
                .workflowRunId(a.getWorkflowRunId())
                .paymentEventId(a.getPaymentEventId())
                .attributedAt(a.getAttributedAt())
                .model(a.getAttributionModel())
                .matchMethod(a.getMatchMethod())
                .confidence(a.getConfidence())
                .amountCents(a.getAmountCents())
                .currency(a.getCurrency())
                .build();
    }

    public WorkflowSendResponse toResponse(WorkflowSend s) {
        return WorkflowSendResponse.builder()
                .id(s.getId())
                .workflowRunId(s.getWorkflowRunId())
                .actionId(s.getActionId())
                .email(s.getEmail())
                .status(s.getStatus())
                .sentAt(s.getSentAt())
                .build();
    }

    RunOutcome summarize(List<WorkflowAttribution> attributions) {
        if (attributions == null || attributions.isEmpty()) {
            return null;
        }
        long revenue = 0;
        MatchMethod bestMethod = null;
        String currency = null;
        for (WorkflowAttribution a : attributions) {
            revenue += a.getAmountCents();
            if (bestMethod == null || a.getMatchMethod().ordinal() < bestMethod.ordinal()) {
                bestMethod = a.getMatchMethod();
            }
            if (currency == null || a.getCurrency().compareTo(currency) > 0) {
                currency = a.getCurrency();
            }
        }
        return RunOutcome.builder()
                .model(MODEL.getTag())
                .windowHours(MODEL.getLookback().toHours())
                .conversions(attributions.size())
                .revenueCents(revenue)
                .currency(currency)
                .confidence(bestMethod.confidence())
                .matchedBy(bestMethod)
                .build();
    }

    private String writeParams(RunContext ctx) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (ctx.getParams() != null) {
            params.putAll(ctx.getParams());
        }
        if (ctx.getLocale() != null && !ctx.getLocale().isBlank()) {
            params.put("locale", ctx.getLocale());
        }
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Run params are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> readParams(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored run params are not valid JSON", e);
        }
    }

    private int pageSize(Integer limit) {
        RunHubProperties.Runs runs = properties.getRuns();
        if (limit == null || limit <= 0) {
            return runs.getDefaultPageSize();
        }
        return Math.min(limit, runs.getMaxPageSize());
    }

    static String formatCursor(WorkflowRun run) {
        return run.getCreatedAt().toString() + CURSOR_SEPARATOR + run.getId();
    }

    /** Parses "{createdAt}_{id}" as written by {@link #formatCursor}. */
    private static Cursor parseCursor(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return null;
        }
        int split = cursor.lastIndexOf(CURSOR_SEPARATOR);
        if (split <= 0) {
            throw new IllegalArgumentException("Invalid cursor: " + cursor);
        }
        try {
            return new Cursor(Instant.parse(cursor.substring(0, split)),
                    UUID.fromString(cursor.substring(split + 1)));
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cursor: " + cursor, e);
        }
    }

    private static final class Cursor {
        final Instant createdAt;
        final UUID id;

        Cursor(Instant createdAt, UUID id) {
            this.createdAt = createdAt;
            this.id = id;
        }
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
