package com.oncall.core.engine;

import com.oncall.core.assessment.ObjectiveAssessor;
import com.oncall.core.assessment.ObjectiveJudge;
import com.oncall.core.config.InvestigatorProperties;
import com.oncall.core.error.InvalidTargetException;
import com.oncall.core.error.InvestigationException;
import com.oncall.core.events.EventBus;
import com.oncall.core.events.InvestigationEvent;
import com.oncall.core.graph.InvestigationGraph;
import com.oncall.core.investigation.CancellationRegistry;
import com.oncall.core.investigation.DeviceInvestigator;
import com.oncall.core.investigation.FanOutCoordinator;
import com.oncall.core.learning.LearningService;
import com.oncall.core.metrics.InvestigationMetrics;
import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.InvestigationStatus;
import com.oncall.core.model.LearningInsights;
import com.oncall.core.model.ObjectiveJudgement;
import com.oncall.core.model.ObjectiveStatus;
import com.oncall.core.model.SessionStatus;
import com.oncall.core.model.StepOutcome;
import com.oncall.core.model.TargetDevice;
import com.oncall.core.model.ToolCallRequest;
import com.oncall.core.model.ToolErrorType;
import com.oncall.core.nodes.AssessObjectiveNode;
import com.oncall.core.nodes.CancelSessionNode;
import com.oncall.core.nodes.ExecuteInvestigationsNode;
import com.oncall.core.nodes.GenerateReportNode;
import com.oncall.core.nodes.PlanInvestigationsNode;
import com.oncall.core.nodes.ValidateInputNode;
import com.oncall.core.oracle.OracleRequest;
import com.oncall.core.oracle.ReasoningOracle;
import com.oncall.core.plan.PlanChoice;
import com.oncall.core.plan.PlanRepository;
import com.oncall.core.plan.PlanSelector;
import com.oncall.core.report.ReportRenderer;
import com.oncall.core.report.ReportSynthesizer;
import com.oncall.core.tools.ToolExecutionException;
import com.oncall.core.tools.ToolExecutor;
import com.oncall.core.validation.TargetResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Runs whole sessions through the real graph, with the model and tool boundaries mocked.
 */
class InvestigationEngineTest {

    private InvestigatorProperties props;
    private SimpleMeterRegistry registry;
    private EventBus eventBus;
    private TargetResolver resolver;
    private PlanSelector selector;
    private ReasoningOracle oracle;
    private ToolExecutor executor;
    private ObjectiveJudge judge;
    private ReportSynthesizer synthesizer;
    private LearningService learning;
    private FanOutCoordinator coordinator;
    private InvestigationEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        props = new InvestigatorProperties();
        props.setMaxConcurrency(4);
        props.setSessionTimeout(Duration.ofSeconds(20));
        props.setCancellationGrace(Duration.ofSeconds(5));

        registry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        resolver = mock(TargetResolver.class);
        selector = mock(PlanSelector.class);
        oracle = mock(ReasoningOracle.class);
        executor = mock(ToolExecutor.class);
        judge = mock(ObjectiveJudge.class);
        synthesizer = mock(ReportSynthesizer.class);
        learning = mock(LearningService.class);

        when(learning.historicalContext()).thenReturn("");
        when(learning.record(any(), any(), any())).thenReturn(LearningInsights.empty());
        when(synthesizer.synthesize(any())).thenReturn("# Investigation Report");
        when(oracle.propose(any())).thenReturn(List.of(new ToolCallRequest("get_interfaces", Map.of())));
        when(executor.execute(any(), anyString())).thenReturn(Map.of("status", "up"));
        when(selector.select(anyString(), anyList(), anyList(), any())).thenAnswer(inv -> {
            List<TargetDevice> devices = inv.getArgument(1);
            var choices = new LinkedHashMap<String, PlanChoice>();
            devices.forEach(d -> choices.put(d.deviceName(), new PlanChoice(d.deviceName(), "interface_status", "")));
            return choices;
        });

        var metrics = new InvestigationMetrics(registry);
        var cancellations = new CancellationRegistry();
        var renderer = new ReportRenderer();
        coordinator = new FanOutCoordinator(new DeviceInvestigator(oracle, executor, metrics), props, eventBus, metrics);
        var graph = new InvestigationGraph(
                new ValidateInputNode(resolver, learning, eventBus),
                new PlanInvestigationsNode(new PlanRepository(props), selector, props, eventBus),
                new ExecuteInvestigationsNode(coordinator, cancellations, eventBus),
                new AssessObjectiveNode(judge, new ObjectiveAssessor(), metrics, eventBus),
                new GenerateReportNode(synthesizer, learning, eventBus),
                new CancelSessionNode(renderer, cancellations, eventBus),
                props,
                null);
        engine = new InvestigationEngine(graph, cancellations, renderer, eventBus, metrics, props);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
        coordinator.shutdown();
    }

    private void targets(String... names) {
        var devices = new ArrayList<TargetDevice>();
        for (String name : names) {
            devices.add(new TargetDevice(name, "cisco_xrd", ""));
        }
        when(resolver.resolve(anyString(), any())).thenReturn(devices);
    }

    /** Judge that is satisfied once a device has run more than {@code unmetPasses} passes. */
    private void judgeMetAfter(int unmetPasses) {
        when(judge.judge(any(), any(), any())).thenAnswer(inv -> {
            DeviceInvestigationState device = inv.getArgument(1);
            return device.attempts() > unmetPasses
                    ? ObjectiveJudgement.met("all interfaces reported")
                    : ObjectiveJudgement.unmet("error counters missing", "Collect error counters");
        });
    }

    private SessionOptions options(int maxRetries) {
        return new SessionOptions(maxRetries, props.getSessionTimeout());
    }

    // -- Termination ----------------------------------------------------------------

    @Nested
    @DisplayName("termination")
    class Termination {

        @ParameterizedTest(name = "objective met after {0} retries")
        @ValueSource(ints = {0, 1, 2})
        @DisplayName("runs exactly k + 1 passes when the objective is met after k retries")
        void terminatesAfterKRetries(int k) {
            targets("xrd-1");
            judgeMetAfter(k);

            InvestigationResult result = engine.submit("check interfaces on xrd-1", options(3));

            assertEquals(SessionStatus.DONE, result.status());
            assertEquals(ObjectiveStatus.ACHIEVED, result.objectiveStatus());
            assertFalse(result.forcedAcceptance());
            assertEquals(k + 1, result.executionPasses());
            assertEquals(k, result.retries());
            assertEquals("# Investigation Report", result.summary());
            assertEquals(3 * (k + 1), result.devices().get("xrd-1").stepOutcomes().size());
        }

        @Test
        @DisplayName("forces acceptance after max-retries + 1 passes")
        void forcedAcceptance() {
            targets("xrd-1");
            judgeMetAfter(Integer.MAX_VALUE);

            InvestigationResult result = engine.submit("check interfaces on xrd-1", options(2));

            assertEquals(SessionStatus.DONE, result.status());
            assertEquals(ObjectiveStatus.ACHIEVED, result.objectiveStatus());
            assertTrue(result.forcedAcceptance());
            assertEquals(3, result.executionPasses());
            assertEquals(2, result.retries());
            verify(judge, times(3)).judge(any(), any(), any());
            assertEquals(1.0, registry.counter("investigator.assessment.forced").count());
        }

        @Test
        @DisplayName("a retry bound larger than the configured iteration limit still ends in forced acceptance")
        void largeRetryBound() {
            targets("xrd-1");
            judgeMetAfter(Integer.MAX_VALUE);

            InvestigationResult result = engine.submit("check interfaces on xrd-1", options(60));

            assertEquals(SessionStatus.DONE, result.status());
            assertEquals(ObjectiveStatus.ACHIEVED, result.objectiveStatus());
            assertTrue(result.forcedAcceptance());
            assertEquals(61, result.executionPasses());
            assertEquals(60, result.retries());
            assertEquals(3 * 61, result.devices().get("xrd-1").stepOutcomes().size());
        }
    }

    // -- History and retry targeting --------------------------------------------------

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("each pass appends to the device history without rewriting it")
        void historyIsMonotonic() {
            targets("xrd-1");
            var snapshots = new CopyOnWriteArrayList<List<StepOutcome>>();
            when(judge.judge(any(), any(), any())).thenAnswer(inv -> {
                DeviceInvestigationState device = inv.getArgument(1);
                snapshots.add(device.stepOutcomes());
                return device.attempts() > 2
                        ? ObjectiveJudgement.met("ok")
                        : ObjectiveJudgement.unmet("gap", "Collect error counters");
            });

            engine.submit("check interfaces on xrd-1", options(3));

            assertEquals(3, snapshots.size());
            for (int i = 1; i < snapshots.size(); i++) {
                List<StepOutcome> before = snapshots.get(i - 1);
                List<StepOutcome> after = snapshots.get(i);
                assertTrue(after.size() > before.size());
                assertEquals(before, after.subList(0, before.size()));
            }
        }

        @Test
        @DisplayName("retry feedback reaches the oracle on the next pass")
        void feedbackReachesOracle() {
            targets("xrd-1");
            judgeMetAfter(1);

            engine.submit("check interfaces on xrd-1", options(3));

            var captor = ArgumentCaptor.forClass(OracleRequest.class);
            verify(oracle, times(6)).propose(captor.capture());
            List<OracleRequest> requests = captor.getAllValues();
            assertNull(requests.get(0).retryFeedback());
            assertEquals("Collect error counters", requests.get(5).retryFeedback());
        }

        @Test
        @DisplayName("only devices that are not yet settled are re-run")
        void retriesOnlyUnsettledDevices() {
            targets("xrd-1", "xrd-2");
            when(judge.judge(any(), any(), any())).thenAnswer(inv -> {
                DeviceInvestigationState device = inv.getArgument(1);
                if (device.deviceName().equals("xrd-1") || device.attempts() >= 2) {
                    return ObjectiveJudgement.met("ok");
                }
                return ObjectiveJudgement.unmet("gap", "Collect error counters");
            });

            InvestigationResult result = engine.submit("compare xrd-1 and xrd-2", options(3));

            assertEquals(ObjectiveStatus.ACHIEVED, result.objectiveStatus());
            assertEquals(2, result.executionPasses());
            assertEquals(1, result.devices().get("xrd-1").attempts());
            assertEquals(2, result.devices().get("xrd-2").attempts());
            assertEquals(3, result.devices().get("xrd-1").stepOutcomes().size());
            assertEquals(6, result.devices().get("xrd-2").stepOutcomes().size());
        }
    }

    // -- Scenarios ----------------------------------------------------------------------

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @Test
        @DisplayName("single device, three-step plan, all tools succeed")
        void singleDevice() throws Exception {
            targets("xrd-1");
            judgeMetAfter(0);
            var events = new CopyOnWriteArrayList<InvestigationEvent>();
            eventBus.subscribeAll(events::add);

            InvestigationResult result = engine.submit("what is the interface status on xrd-1?", options(3));

            DeviceInvestigationState device = result.devices().get("xrd-1");
            assertEquals(InvestigationStatus.COMPLETED, device.status());
            assertEquals("interface_status", device.intent());
            assertEquals(List.of(0, 1, 2), device.stepOutcomes().stream().map(StepOutcome::stepIndex).toList());
            assertTrue(device.stepOutcomes().stream().allMatch(StepOutcome::hasSuccessfulInvocation));
            assertNull(device.limitationsNotes());
            verify(executor, times(3)).execute(any(), eq("xrd-1"));
            verify(learning).record(anyString(), eq("what is the interface status on xrd-1?"),
                    eq("# Investigation Report"));
            List<String> types = events.stream().map(InvestigationEvent::eventType).toList();
            assertEquals("session.created", types.get(0));
            assertEquals("session.finished", types.get(types.size() - 1));
            assertTrue(types.contains("device.completed"));
        }

        @Test
        @DisplayName("two devices, one unreachable: failures are recorded and the session still completes")
        void communicationErrorOnOneDevice() throws Exception {
            targets("xrd-1", "xrd-2");
            when(executor.execute(any(), eq("xrd-2")))
                    .thenThrow(new ToolExecutionException(ToolErrorType.COMMUNICATION, "connection timed out"));
            when(judge.judge(any(), any(), any())).thenAnswer(inv -> {
                DeviceInvestigationState device = inv.getArgument(1);
                return device.deviceName().equals("xrd-2")
                        ? ObjectiveJudgement.limited("device unreachable")
                        : ObjectiveJudgement.met("ok");
            });

            InvestigationResult result = engine.submit("check xrd-1 and xrd-2", options(3));

            assertEquals(ObjectiveStatus.ACHIEVED, result.objectiveStatus());
            assertEquals(1, result.executionPasses());
            DeviceInvestigationState unreachable = result.devices().get("xrd-2");
            assertEquals(InvestigationStatus.COMPLETED, unreachable.status());
            assertEquals(3, unreachable.stepOutcomes().size());
            assertTrue(unreachable.stepOutcomes().stream()
                    .flatMap(o -> o.invocations().stream())
                    .allMatch(i -> i.error() != null && i.error().type() == ToolErrorType.COMMUNICATION));
            assertNotNull(unreachable.limitationsNotes());
            assertNull(result.devices().get("xrd-1").limitationsNotes());
            assertEquals(3.0, registry.counter("investigator.tool.errors", "type", "COMMUNICATION").count());
        }
    }

    // -- Fatal errors ---------------------------------------------------------------------

    @Nested
    @DisplayName("fatal errors")
    class FatalErrors {

        @Test
        @DisplayName("no resolvable device fails the session before any tool runs")
        void invalidTarget() throws Exception {
            when(resolver.resolve(anyString(), any())).thenReturn(List.of());

            assertThrows(InvalidTargetException.class,
                    () -> engine.submit("check the coffee machine", options(3)));
            verify(executor, never()).execute(any(), anyString());
            assertEquals(1.0, registry.counter("investigator.sessions.total", "objective", "FAILED").count());
        }

        @Test
        @DisplayName("a plan selection failure without a default intent is fatal")
        void planSelectionFailure() {
            targets("xrd-1");
            when(selector.select(anyString(), anyList(), anyList(), any()))
                    .thenThrow(new IllegalStateException("model unavailable"));

            var e = assertThrows(InvestigationException.class,
                    () -> engine.submit("check xrd-1", options(3)));
            assertTrue(e.getMessage().contains("model unavailable"));
        }

        @Test
        @DisplayName("a plan selection failure falls back to the default intent when one is configured")
        void planSelectionFallback() {
            props.getPlans().setDefaultIntent("device_health");
            targets("xrd-1");
            judgeMetAfter(0);
            when(selector.select(anyString(), anyList(), anyList(), any()))
                    .thenThrow(new IllegalStateException("model unavailable"));

            InvestigationResult result = engine.submit("check xrd-1", options(3));

            assertEquals(ObjectiveStatus.ACHIEVED, result.objectiveStatus());
            assertEquals("device_health", result.devices().get("xrd-1").intent());
        }
    }

    // -- Cancellation -----------------------------------------------------------------------

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("a cancel request stops devices between steps and keeps partial results")
        void cooperativeCancel() throws Exception {
            targets("xrd-1");
            judgeMetAfter(0);
            var sessionId = new AtomicReference<String>();
            eventBus.subscribeAll(e -> sessionId.compareAndSet(null, e.sessionId()));
            when(executor.execute(any(), anyString())).thenAnswer(inv -> {
                engine.cancel(sessionId.get());
                return Map.of();
            });

            InvestigationResult result = engine.submit("check xrd-1", options(3));

            assertEquals(SessionStatus.CANCELLED, result.status());
            assertEquals(ObjectiveStatus.CANCELLED, result.objectiveStatus());
            DeviceInvestigationState device = result.devices().get("xrd-1");
            assertEquals(InvestigationStatus.CANCELLED, device.status());
            assertEquals(1, device.stepOutcomes().size());
            assertTrue(device.limitationsNotes().contains("Cancelled before step 2 of 3"));
            assertTrue(result.summary().contains("Investigation Cancelled"));
            assertTrue(result.summary().contains("_Reason: cancelled on request_"));
            verify(judge, never()).judge(any(), any(), any());
        }

        @Test
        @DisplayName("a timed-out session that ignores cancellation is interrupted after the grace period")
        void interruptAfterGrace() throws Exception {
            props.setCancellationGrace(Duration.ofMillis(200));
            targets("xrd-1");
            var calls = new AtomicInteger();
            when(executor.execute(any(), anyString())).thenAnswer(inv -> {
                if (calls.incrementAndGet() == 1) {
                    return Map.of("status", "up");
                }
                Thread.sleep(30_000);
                return Map.of();
            });

            long start = System.currentTimeMillis();
            InvestigationResult result = engine.submit("check xrd-1",
                    new SessionOptions(3, Duration.ofMillis(500)));

            assertTrue(System.currentTimeMillis() - start < 10_000);
            assertEquals(SessionStatus.CANCELLED, result.status());
            assertEquals(ObjectiveStatus.CANCELLED, result.objectiveStatus());
            assertTrue(result.summary().contains("_Reason: session timeout"));
            assertEquals(2, calls.get());
            assertEquals(1, result.executionPasses());

            DeviceInvestigationState device = result.devices().get("xrd-1");
            assertNotNull(device);
            assertEquals(InvestigationStatus.CANCELLED, device.status());
            assertEquals(1, device.stepOutcomes().size());
            assertTrue(device.stepOutcomes().get(0).hasSuccessfulInvocation());
            assertTrue(device.limitationsNotes().contains("Interrupted after step 1 of 3"));
            assertTrue(result.summary().contains("xrd-1"));
        }

        @Test
        @DisplayName("devices planned but not yet started still appear in an interrupted session")
        void interruptBeforeFirstStep() throws Exception {
            props.setCancellationGrace(Duration.ofMillis(200));
            targets("xrd-1");
            when(oracle.propose(any())).thenAnswer(inv -> {
                Thread.sleep(30_000);
                return List.of();
            });

            InvestigationResult result = engine.submit("check xrd-1",
                    new SessionOptions(3, Duration.ofMillis(300)));

            assertEquals(SessionStatus.CANCELLED, result.status());
            DeviceInvestigationState device = result.devices().get("xrd-1");
            assertNotNull(device);
            assertEquals(InvestigationStatus.CANCELLED, device.status());
            assertEquals("interface_status", device.intent());
            assertTrue(device.stepOutcomes().isEmpty());
            assertEquals(1, result.executionPasses());
        }

        @Test
        @DisplayName("an async session can be polled and cancelled")
        void asyncCancel() throws Exception {
            targets("xrd-1");
            when(executor.execute(any(), anyString())).thenAnswer(inv -> {
                Thread.sleep(300);
                return Map.of();
            });

            String sessionId = engine.submitAsync("check xrd-1", options(3));
            assertTrue(sessionId.startsWith("INV-"));
            assertTrue(engine.status(sessionId).isPresent());

            long deadline = System.currentTimeMillis() + 5_000;
            while (!engine.cancel(sessionId) && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            InvestigationResult result = null;
            while (System.currentTimeMillis() < deadline) {
                result = engine.status(sessionId).orElseThrow();
                if (result.isFinished()) break;
                Thread.sleep(50);
            }
            assertNotNull(result);
            assertEquals(SessionStatus.CANCELLED, result.status());
            assertTrue(engine.status("INV-unknown").isEmpty());
        }
    }
}
