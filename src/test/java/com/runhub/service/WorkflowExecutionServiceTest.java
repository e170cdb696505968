package com.runhub.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.runhub.config.RunHubProperties;
import com.runhub.dto.*;
import com.runhub.model.*;
import com.runhub.repository.WorkflowAttributionRepository;
import com.runhub.repository.WorkflowRunRepository;
import com.runhub.repository.WorkflowSendRepository;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for WorkflowExecutionService.
 *
 * Repositories are mocked; where a test needs the store to behave like a table
 * with a unique key, a small map-backed answer stands in for it. The transaction
 * manager is a plain mock so IdempotentInsert runs its real logic.
 */
@ExtendWith(MockitoExtension.class)
class WorkflowExecutionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String PROJECT = "p1";
    private static final String CART = "cart_abandoned";

    @Mock private WorkflowRunRepository runRepository;
    @Mock private WorkflowSendRepository sendRepository;
    @Mock private WorkflowAttributionRepository attributionRepository;
    @Mock private PlatformTransactionManager transactionManager;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private RunHubProperties properties;
    private WorkflowExecutionService service;

    @BeforeEach
    void setUp() {
        properties = new RunHubProperties();
        service = new WorkflowExecutionService(runRepository, sendRepository, attributionRepository,
                new IdempotentInsert(transactionManager), objectMapper, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static WorkflowRun run(String project, String action, String key, Instant createdAt) {
        return WorkflowRun.builder()
                .id(UUID.randomUUID())
                .projectId(project)
                .actionId(action)
                .idempotencyKey(key)
                .triggeredBy("user_1")
                .params("{}")
                .createdAt(createdAt)
                .build();
    }

    private static PaymentEvent payment(String id) {
        return PaymentEvent.builder()
                .paymentEventId(id)
                .projectId(PROJECT)
                .occurredAt(NOW)
                .amountCents(4900L)
                .currency("usd")
                .build();
    }

    private static MatchCandidate candidate(WorkflowRun run, MatchMethod method) {
        return MatchCandidate.builder().runId(run.getId()).matchMethod(method).build();
    }

    /** Makes runRepository behave like workflow_runs with its (project, action, key) constraint. */
    private Map<String, WorkflowRun> backRunsWithTable() {
        Map<String, WorkflowRun> table = new HashMap<>();
        when(runRepository.findByProjectIdAndActionIdAndIdempotencyKey(anyString(), anyString(), anyString()))
                .thenAnswer(inv -> Optional.ofNullable(table.get(
                        inv.getArgument(0) + "|" + inv.getArgument(1) + "|" + inv.getArgument(2))));
        when(runRepository.saveAndFlush(any(WorkflowRun.class))).thenAnswer(inv -> {
            WorkflowRun r = inv.getArgument(0);
            WorkflowRun saved = WorkflowRun.builder()
                    .id(UUID.randomUUID())
                    .projectId(r.getProjectId())
                    .actionId(r.getActionId())
                    .idempotencyKey(r.getIdempotencyKey())
                    .triggeredBy(r.getTriggeredBy())
                    .params(r.getParams())
                    .createdAt(r.getCreatedAt())
                    .build();
            table.put(r.getProjectId() + "|" + r.getActionId() + "|" + r.getIdempotencyKey(), saved);
            return saved;
        });
        return table;
    }

    @Nested
    @DisplayName("startRun")
    class StartRun {

        @Test
        @DisplayName("Same (project, action, key) twice returns the same run id")
        void sameKey_shouldReturnSameRun() {
            backRunsWithTable();

            StartRunResult first = service.startRun(PROJECT, CART, "k1", null);
            StartRunResult second = service.startRun(PROJECT, CART, "k1", null);

            assertEquals(first.getRun().getId(), second.getRun().getId());
            assertFalse(first.isDeduplicated());
            assertTrue(second.isDeduplicated());
            verify(runRepository, times(1)).saveAndFlush(any(WorkflowRun.class));
        }

        @Test
        @DisplayName("Same key under a different action creates a different run")
        void sameKeyOtherAction_shouldCreateNewRun() {
            backRunsWithTable();

            StartRunResult first = service.startRun(PROJECT, CART, "k1", null);
            StartRunResult again = service.startRun(PROJECT, CART, "k1", null);
            StartRunResult other = service.startRun(PROJECT, "other_action", "k1", null);

            assertEquals(first.getRun().getId(), again.getRun().getId());
            assertNotEquals(first.getRun().getId(), other.getRun().getId());
            assertFalse(other.isDeduplicated());
        }

        @Test
        @DisplayName("Losing the insert race re-reads and returns the winning run")
        void uniquenessViolation_shouldFallBackToExistingRun() {
            WorkflowRun winner = run(PROJECT, CART, "k1", NOW.minusSeconds(1));
            when(runRepository.findByProjectIdAndActionIdAndIdempotencyKey(PROJECT, CART, "k1"))
                    .thenReturn(Optional.empty(), Optional.of(winner));
            when(runRepository.saveAndFlush(any(WorkflowRun.class)))
                    .thenThrow(new DataIntegrityViolationException("uq_workflow_runs_idempotency"));

            StartRunResult result = service.startRun(PROJECT, CART, "k1", null);

            assertSame(winner, result.getRun());
            assertTrue(result.isDeduplicated());
        }

        @Test
        @DisplayName("A violation with no row to fall back to is rethrown")
        void uniquenessViolationWithoutWinner_shouldPropagate() {
            when(runRepository.findByProjectIdAndActionIdAndIdempotencyKey(PROJECT, CART, "k1"))
                    .thenReturn(Optional.empty());
            when(runRepository.saveAndFlush(any(WorkflowRun.class)))
                    .thenThrow(new DataIntegrityViolationException("fk violation"));

            assertThrows(DataIntegrityViolationException.class,
                    () -> service.startRun(PROJECT, CART, "k1", null));
        }

        @Test
        @DisplayName("New run stores context, merges locale into params and stamps the clock")
        void newRun_shouldPersistContext() {
            when(runRepository.findByProjectIdAndActionIdAndIdempotencyKey(PROJECT, CART, "k1"))
                    .thenReturn(Optional.empty());
            when(runRepository.saveAndFlush(any(WorkflowRun.class))).thenAnswer(inv -> inv.getArgument(0));

            service.startRun(PROJECT, CART, "k1", RunContext.builder()
                    .triggeredBy("user_9")
                    .params(Map.of("segmentation", "recent_7d"))
                    .locale("ar")
                    .recipientCountEstimate(12)
                    .build());

            ArgumentCaptor<WorkflowRun> saved = ArgumentCaptor.forClass(WorkflowRun.class);
            verify(runRepository).saveAndFlush(saved.capture());
            assertEquals("user_9", saved.getValue().getTriggeredBy());
            assertEquals(NOW, saved.getValue().getCreatedAt());
            assertEquals(12, saved.getValue().getRecipientCountEstimate());
            assertTrue(saved.getValue().getParams().contains("\"locale\":\"ar\""));
            assertTrue(saved.getValue().getParams().contains("\"segmentation\":\"recent_7d\""));
        }

        @Test
        @DisplayName("Blank idempotency key is rejected")
        void blankKey_shouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> service.startRun(PROJECT, CART, " ", null));
            verifyNoInteractions(runRepository);
        }
    }

    @Nested
    @DisplayName("buildRecipients")
    class BuildRecipients {

        @Test
        @DisplayName("Recipient sent-to an hour ago is excluded under a 24h cooldown")
        void recentSend_shouldExclude() {
            WorkflowSend recent = WorkflowSend.builder()
                    .email("a@x.com").status(SendStatus.SENT).sentAt(NOW.minus(Duration.ofHours(1))).build();
            when(sendRepository.findByProjectIdAndActionIdAndStatusAndSentAtAfterAndEmailIn(
                    eq(PROJECT), eq(CART), eq(SendStatus.SENT), eq(NOW.minus(Duration.ofHours(24))), anyCollection()))
                    .thenReturn(List.of(recent));

            List<String> eligible = service.buildRecipients(
                    PROJECT, CART, List.of("a@x.com", "b@x.com"), Duration.ofHours(24));

            assertEquals(List.of("b@x.com"), eligible);
        }

        @Test
        @DisplayName("Recipients without a send inside the window are all included, order preserved")
        void noRecentSend_shouldIncludeAll() {
            when(sendRepository.findByProjectIdAndActionIdAndStatusAndSentAtAfterAndEmailIn(
                    any(), any(), any(), any(), anyCollection()))
                    .thenReturn(List.of());

            List<String> eligible = service.buildRecipients(
                    PROJECT, CART, List.of("c@x.com", "a@x.com", "b@x.com"), Duration.ofHours(24));

            assertEquals(List.of("c@x.com", "a@x.com", "b@x.com"), eligible);
        }

        @Test
        @DisplayName("Zero cooldown skips the lookup entirely")
        void zeroWindow_shouldNotFilter() {
            List<String> eligible = service.buildRecipients(
                    PROJECT, CART, List.of("a@x.com", "b@x.com"), Duration.ZERO);

            assertEquals(List.of("a@x.com", "b@x.com"), eligible);
            verifyNoInteractions(sendRepository);
        }

        @Test
        @DisplayName("Candidates are lower-cased, de-duplicated and blanks dropped")
        void candidates_shouldBeNormalized() {
            List<String> eligible = service.buildRecipients(
                    PROJECT, CART, Arrays.asList("B@X.com", " b@x.com", "", null, "a@x.com"), Duration.ZERO);

            assertEquals(List.of("b@x.com", "a@x.com"), eligible);
        }

        @Test
        @DisplayName("normalizeCandidates tolerates a null list")
        void normalizeCandidates_nullList_shouldBeEmpty() {
            assertTrue(WorkflowExecutionService.normalizeCandidates(null).isEmpty());
        }

        @Test
        @DisplayName("Null window falls back to the configured default cooldown")
        void nullWindow_shouldUseDefault() {
            properties.getRecipients().setDefaultCooldown(Duration.ofHours(6));
            when(sendRepository.findByProjectIdAndActionIdAndStatusAndSentAtAfterAndEmailIn(
                    eq(PROJECT), eq(CART), eq(SendStatus.SENT), eq(NOW.minus(Duration.ofHours(6))), anyCollection()))
                    .thenReturn(List.of());

            assertEquals(List.of("a@x.com"), service.buildRecipients(PROJECT, CART, List.of("a@x.com"), null));
        }

        @Test
        @DisplayName("Negative window is rejected")
        void negativeWindow_shouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> service.buildRecipients(
                    PROJECT, CART, List.of("a@x.com"), Duration.ofHours(-1)));
        }
    }

    @Nested
    @DisplayName("recordSend")
    class RecordSend {

        @Test
        @DisplayName("Recording twice for the same (run, email) leaves one row with the second status")
        void secondCall_shouldUpdateExistingRow() {
            WorkflowRun run = run(PROJECT, CART, "k1", NOW);
            Map<String, WorkflowSend> table = new HashMap<>();
            when(sendRepository.findByWorkflowRunIdAndEmail(eq(run.getId()), anyString()))
                    .thenAnswer(inv -> Optional.ofNullable(table.get(inv.<String>getArgument(1))));
            when(sendRepository.saveAndFlush(any(WorkflowSend.class))).thenAnswer(inv -> {
                WorkflowSend s = inv.getArgument(0);
                s.setId(UUID.randomUUID());
                table.put(s.getEmail(), s);
                return s;
            });
            when(sendRepository.save(any(WorkflowSend.class))).thenAnswer(inv -> inv.getArgument(0));

            WorkflowSend first = service.recordSend(run, "A@x.com", SendStatus.FAILED);
            WorkflowSend second = service.recordSend(run, "a@x.com", SendStatus.SENT);

            assertEquals(1, table.size());
            assertEquals(first.getId(), second.getId());
            assertEquals(SendStatus.SENT, table.get("a@x.com").getStatus());
            verify(sendRepository, times(1)).saveAndFlush(any(WorkflowSend.class));
            verify(sendRepository, times(1)).save(any(WorkflowSend.class));
        }

        @Test
        @DisplayName("Concurrent first insert loses the race and updates the winner's row")
        void uniquenessViolation_shouldUpdateWinner() {
            WorkflowRun run = run(PROJECT, CART, "k1", NOW);
            WorkflowSend winner = WorkflowSend.builder()
                    .id(UUID.randomUUID()).workflowRunId(run.getId()).email("a@x.com")
                    .status(SendStatus.SENT).sentAt(NOW.minusSeconds(5)).build();
            when(sendRepository.findByWorkflowRunIdAndEmail(run.getId(), "a@x.com"))
                    .thenReturn(Optional.empty(), Optional.of(winner));
            when(sendRepository.saveAndFlush(any(WorkflowSend.class)))
                    .thenThrow(new DataIntegrityViolationException("uq_workflow_sends_run_email"));
            when(sendRepository.save(winner)).thenReturn(winner);

            WorkflowSend result = service.recordSend(run, "a@x.com", SendStatus.SUPPRESSED);

            assertSame(winner, result);
            assertEquals(SendStatus.SUPPRESSED, winner.getStatus());
            assertEquals(NOW, winner.getSentAt());
        }

        @Test
        @DisplayName("recordSend by id throws when the run does not exist")
        void unknownRun_shouldThrow() {
            UUID id = UUID.randomUUID();
            when(runRepository.findById(id)).thenReturn(Optional.empty());

            assertThrows(EntityNotFoundException.class, () -> service.recordSend(id, "a@x.com", SendStatus.SENT));
        }
    }

    @Nested
    @DisplayName("attributeOutcome")
    class AttributeOutcome {

        private Map<String, WorkflowAttribution> backAttributionsWithTable() {
            Map<String, WorkflowAttribution> table = new HashMap<>();
            when(attributionRepository.findByPaymentEventId(anyString()))
                    .thenAnswer(inv -> Optional.ofNullable(table.get(inv.<String>getArgument(0))));
            when(attributionRepository.saveAndFlush(any(WorkflowAttribution.class))).thenAnswer(inv -> {
                WorkflowAttribution a = inv.getArgument(0);
                table.put(a.getPaymentEventId(), a);
                return a;
            });
            return table;
        }

        @Test
        @DisplayName("Same payment twice returns the same attribution and inserts once")
        void samePaymentTwice_shouldReturnSameAttribution() {
            Map<String, WorkflowAttribution> table = backAttributionsWithTable();
            WorkflowRun run1 = run(PROJECT, CART, "k1", NOW.minus(Duration.ofHours(3)));
            when(runRepository.findAllById(anyIterable())).thenReturn(List.of(run1));

            Optional<WorkflowAttribution> first = service.attributeOutcome(
                    payment("pay_1"), List.of(candidate(run1, MatchMethod.EMAIL)));
            Optional<WorkflowAttribution> second = service.attributeOutcome(
                    payment("pay_1"), List.of(candidate(run1, MatchMethod.EMAIL)));

            assertTrue(first.isPresent());
            assertSame(first.get(), second.get());
            assertEquals(1, table.size());
            verify(attributionRepository, times(1)).saveAndFlush(any(WorkflowAttribution.class));
        }

        @Test
        @DisplayName("Two payments matching the same run each get their own attribution")
        void twoPaymentsSameRun_shouldEachBeAttributed() {
            Map<String, WorkflowAttribution> table = backAttributionsWithTable();
            WorkflowRun run1 = run(PROJECT, CART, "k1", NOW.minus(Duration.ofHours(3)));
            when(runRepository.findAllById(anyIterable())).thenReturn(List.of(run1));

            WorkflowAttribution a = service.attributeOutcome(
                    payment("pay_1"), List.of(candidate(run1, MatchMethod.AMOUNT))).orElseThrow();
            WorkflowAttribution b = service.attributeOutcome(
                    payment("pay_2"), List.of(candidate(run1, MatchMethod.AMOUNT))).orElseThrow();

            assertEquals(2, table.size());
            assertEquals(run1.getId(), a.getWorkflowRunId());
            assertEquals(run1.getId(), b.getWorkflowRunId());
            assertEquals(AttributionConfidence.LOW, a.getConfidence());
        }

        @Test
        @DisplayName("Stronger match method wins over a more recent weaker one")
        void strongerMethod_shouldWin() {
            backAttributionsWithTable();
            WorkflowRun older = run(PROJECT, CART, "k1", NOW.minus(Duration.ofHours(30)));
            WorkflowRun newer = run(PROJECT, CART, "k2", NOW.minus(Duration.ofHours(1)));
            when(runRepository.findAllById(anyIterable())).thenReturn(List.of(older, newer));

            WorkflowAttribution a = service.attributeOutcome(payment("pay_1"), List.of(
                    candidate(newer, MatchMethod.AMOUNT),
                    candidate(older, MatchMethod.EMAIL))).orElseThrow();

            assertEquals(older.getId(), a.getWorkflowRunId());
            assertEquals(MatchMethod.EMAIL, a.getMatchMethod());
            assertEquals(AttributionConfidence.MEDIUM, a.getConfidence());
            assertEquals("last_touch_48h", a.getAttributionModel());
            assertEquals("USD", a.getCurrency());
            assertEquals(4900L, a.getAmountCents());
            assertEquals(NOW, a.getAttributedAt());
        }

        @Test
        @DisplayName("Equal confidence goes to the most recent run")
        void equalConfidence_shouldPickMostRecent() {
            backAttributionsWithTable();
            WorkflowRun older = run(PROJECT, CART, "k1", NOW.minus(Duration.ofHours(5)));
            WorkflowRun newer = run(PROJECT, CART, "k2", NOW.minus(Duration.ofHours(2)));
            when(runRepository.findAllById(anyIterable())).thenReturn(List.of(older, newer));

            WorkflowAttribution a = service.attributeOutcome(payment("pay_1"), List.of(
                    candidate(older, MatchMethod.CART),
                    candidate(newer, MatchMethod.AMOUNT))).orElseThrow();

            assertEquals(newer.getId(), a.getWorkflowRunId());
        }

        @Test
        @DisplayName("Runs outside the 48h lookback, after the payment, or in another project are ignored")
        void ineligibleRuns_shouldYieldNothing() {
            when(attributionRepository.findByPaymentEventId("pay_1")).thenReturn(Optional.empty());
            WorkflowRun tooOld = run(PROJECT, CART, "k1", NOW.minus(Duration.ofHours(49)));
            WorkflowRun afterPayment = run(PROJECT, CART, "k2", NOW.plusSeconds(60));
            WorkflowRun otherProject = run("p2", CART, "k3", NOW.minus(Duration.ofHours(1)));
            when(runRepository.findAllById(anyIterable())).thenReturn(List.of(tooOld, afterPayment, otherProject));

            Optional<WorkflowAttribution> result = service.attributeOutcome(payment("pay_1"), List.of(
                    candidate(tooOld, MatchMethod.LINK),
                    candidate(afterPayment, MatchMethod.LINK),
                    candidate(otherProject, MatchMethod.LINK)));

            assertTrue(result.isEmpty());
            verify(attributionRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Payment already attributed returns the existing row without touching candidates")
        void alreadyAttributed_shouldReturnExisting() {
            WorkflowAttribution existing = WorkflowAttribution.builder()
                    .id(UUID.randomUUID()).paymentEventId("pay_1").workflowRunId(UUID.randomUUID()).build();
            when(attributionRepository.findByPaymentEventId("pay_1")).thenReturn(Optional.of(existing));

            Optional<WorkflowAttribution> result = service.attributeOutcome(payment("pay_1"),
                    List.of(candidate(run(PROJECT, CART, "k1", NOW), MatchMethod.LINK)));

            assertSame(existing, result.orElseThrow());
            verifyNoInteractions(runRepository);
        }

        @Test
        @DisplayName("Concurrent duplicate delivery resolves to the first writer's attribution")
        void concurrentDuplicate_shouldReturnWinner() {
            WorkflowRun run1 = run(PROJECT, CART, "k1", NOW.minus(Duration.ofHours(1)));
            WorkflowAttribution winner = WorkflowAttribution.builder()
                    .id(UUID.randomUUID()).paymentEventId("pay_1").workflowRunId(run1.getId()).build();
            when(attributionRepository.findByPaymentEventId("pay_1"))
                    .thenReturn(Optional.empty(), Optional.empty(), Optional.of(winner));
            when(runRepository.findAllById(anyIterable())).thenReturn(List.of(run1));
            when(attributionRepository.saveAndFlush(any(WorkflowAttribution.class)))
                    .thenThrow(new DataIntegrityViolationException("uq_workflow_attributions_payment"));

            Optional<WorkflowAttribution> result = service.attributeOutcome(
                    payment("pay_1"), List.of(candidate(run1, MatchMethod.LINK)));

            assertSame(winner, result.orElseThrow());
        }

        @Test
        @DisplayName("No candidates yields no attribution")
        void noCandidates_shouldYieldNothing() {
            when(attributionRepository.findByPaymentEventId("pay_1")).thenReturn(Optional.empty());

            assertTrue(service.attributeOutcome(payment("pay_1"), List.of()).isEmpty());
        }

        @Test
        @DisplayName("Negative amount is rejected")
        void negativeAmount_shouldThrow() {
            PaymentEvent bad = payment("pay_1");
            bad.setAmountCents(-1L);

            assertThrows(IllegalArgumentException.class, () -> service.attributeOutcome(bad, List.of()));
        }

        @Test
        @DisplayName("Currency that is not a three-letter code is rejected before any write")
        void nonIsoCurrency_shouldThrow() {
            PaymentEvent bad = payment("pay_1");
            bad.setCurrency("US DOLLARS");
            WorkflowRun run1 = run(PROJECT, CART, "k1", NOW.minus(Duration.ofHours(1)));

            assertThrows(IllegalArgumentException.class,
                    () -> service.attributeOutcome(bad, List.of(candidate(run1, MatchMethod.LINK))));
            verifyNoInteractions(attributionRepository, runRepository);
        }
    }

    @Nested
    @DisplayName("getRun / listRuns")
    class Reads {

        @Test
        @DisplayName("getRun summarizes attributions into an outcome")
        void getRun_shouldIncludeOutcome() {
            WorkflowRun run1 = WorkflowRun.builder()
                    .id(UUID.randomUUID()).projectId(PROJECT).actionId(CART).idempotencyKey("k1")
                    .triggeredBy("user_1").params("{\"locale\":\"en\"}").createdAt(NOW).build();
            when(runRepository.findById(run1.getId())).thenReturn(Optional.of(run1));
            when(attributionRepository.findByWorkflowRunId(run1.getId())).thenReturn(List.of(
                    WorkflowAttribution.builder().workflowRunId(run1.getId()).amountCents(1000)
                            .currency("USD").matchMethod(MatchMethod.AMOUNT).confidence(AttributionConfidence.LOW).build(),
                    WorkflowAttribution.builder().workflowRunId(run1.getId()).amountCents(2500)
                            .currency("USD").matchMethod(MatchMethod.EMAIL).confidence(AttributionConfidence.MEDIUM).build()));

            WorkflowRunResponse response = service.getRun(run1.getId());

            assertEquals("en", response.getParams().get("locale"));
            RunOutcome outcome = response.getOutcome();
            assertNotNull(outcome);
            assertEquals(2, outcome.getConversions());
            assertEquals(3500, outcome.getRevenueCents());
            assertEquals(48, outcome.getWindowHours());
            assertEquals(AttributionConfidence.MEDIUM, outcome.getConfidence());
            assertEquals(MatchMethod.EMAIL, outcome.getMatchedBy());
        }

        @Test
        @DisplayName("getRun without attributions has no outcome")
        void getRun_withoutAttributions_shouldOmitOutcome() {
            WorkflowRun run1 = run(PROJECT, CART, "k1", NOW);
            when(runRepository.findById(run1.getId())).thenReturn(Optional.of(run1));
            when(attributionRepository.findByWorkflowRunId(run1.getId())).thenReturn(List.of());

            assertNull(service.getRun(run1.getId()).getOutcome());
        }

        @Test
        @DisplayName("getRun throws when the run does not exist")
        void getRun_shouldThrowWhenNotFound() {
            UUID id = UUID.randomUUID();
            when(runRepository.findById(id)).thenReturn(Optional.empty());

            assertThrows(EntityNotFoundException.class, () -> service.getRun(id));
        }

        @Test
        @DisplayName("listRuns fetches one extra row and returns a cursor when more exist")
        void listRuns_shouldPaginate() {
            WorkflowRun r1 = run(PROJECT, CART, "k3", NOW);
            WorkflowRun r2 = run(PROJECT, CART, "k2", NOW.minusSeconds(60));
            WorkflowRun r3 = run(PROJECT, CART, "k1", NOW.minusSeconds(120));
            when(runRepository.findByProjectIdOrderByCreatedAtDescIdDesc(PROJECT, PageRequest.of(0, 3)))
                    .thenReturn(List.of(r1, r2, r3));
            when(attributionRepository.findByWorkflowRunIdIn(List.of(r1.getId(), r2.getId())))
                    .thenReturn(List.of());

            RunPage page = service.listRuns(PROJECT, null, null, 2);

            assertEquals(2, page.getRuns().size());
            assertEquals(r2.getCreatedAt() + "_" + r2.getId(), page.getNextCursor());
        }

        @Test
        @DisplayName("listRuns with action and cursor uses the keyset query and caps the limit")
        void listRuns_withCursor_shouldUseKeysetQuery() {
            Instant createdAt = NOW.minusSeconds(60);
            UUID lastId = UUID.randomUUID();
            when(runRepository.findPageBeforeForAction(PROJECT, CART, createdAt, lastId, PageRequest.of(0, 101)))
                    .thenReturn(List.of());

            RunPage page = service.listRuns(PROJECT, CART, createdAt + "_" + lastId, 500);

            assertTrue(page.getRuns().isEmpty());
            assertNull(page.getNextCursor());
            verifyNoInteractions(attributionRepository);
        }

        @Test
        @DisplayName("Runs sharing a timestamp across a page boundary are all returned")
        void listRuns_sameTimestamp_shouldNotSkipRuns() {
            WorkflowRun a = run(PROJECT, CART, "k1", NOW);
            WorkflowRun b = run(PROJECT, CART, "k2", NOW);
            WorkflowRun c = run(PROJECT, CART, "k3", NOW);
            when(runRepository.findByProjectIdOrderByCreatedAtDescIdDesc(PROJECT, PageRequest.of(0, 2)))
                    .thenReturn(List.of(a, b));
            when(runRepository.findPageBefore(PROJECT, NOW, a.getId(), PageRequest.of(0, 2)))
                    .thenReturn(List.of(b, c));
            when(runRepository.findPageBefore(PROJECT, NOW, b.getId(), PageRequest.of(0, 2)))
                    .thenReturn(List.of(c));
            when(attributionRepository.findByWorkflowRunIdIn(anyCollection())).thenReturn(List.of());

            RunPage first = service.listRuns(PROJECT, null, null, 1);
            RunPage second = service.listRuns(PROJECT, null, first.getNextCursor(), 1);
            RunPage third = service.listRuns(PROJECT, null, second.getNextCursor(), 1);

            assertEquals(a.getId(), first.getRuns().get(0).getId());
            assertEquals(b.getId(), second.getRuns().get(0).getId());
            assertEquals(c.getId(), third.getRuns().get(0).getId());
            assertNull(third.getNextCursor());
        }

        @Test
        @DisplayName("listRuns rejects a malformed cursor")
        void listRuns_badCursor_shouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> service.listRuns(PROJECT, null, "yesterday", null));
            assertThrows(IllegalArgumentException.class,
                    () -> service.listRuns(PROJECT, null, NOW.toString(), null));
            assertThrows(IllegalArgumentException.class,
                    () -> service.listRuns(PROJECT, null, NOW + "_not-a-uuid", null));
        }
    }
}
