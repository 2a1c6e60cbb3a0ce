package com.oncall.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeviceInvestigationStateTest {

    private static final InvestigationPlan PLAN =
            new InvestigationPlan("bgp_neighbors", "Verify BGP sessions", List.of("Show neighbors", "Show routes"));

    private static StepOutcome outcome(int attempt, int step, ToolInvocation... invocations) {
        return new StepOutcome(attempt, step, PLAN.steps().get(step), List.of(invocations));
    }

    private static DeviceInvestigationState pending() {
        return DeviceInvestigationState.pending(new TargetDevice("xrd-1", null, null), PLAN, "Verify BGP sessions");
    }

    // -- TargetDevice ---------------------------------------------------------

    @Nested
    @DisplayName("TargetDevice")
    class TargetDeviceTests {

        @Test
        @DisplayName("blank profile becomes unknown and null role becomes empty")
        void normalizes() {
            var device = new TargetDevice("xrd-1", " ", null);
            assertEquals(TargetDevice.UNKNOWN_PROFILE, device.deviceProfile());
            assertEquals("", device.role());
        }
    }

    // -- Transitions ----------------------------------------------------------

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        @DisplayName("pending state copies the plan and has no history")
        void pendingState() {
            var state = pending();
            assertEquals(InvestigationStatus.PENDING, state.status());
            assertEquals("bgp_neighbors", state.intent());
            assertEquals(PLAN.steps(), state.planSteps());
            assertEquals(0, state.attempts());
            assertTrue(state.stepOutcomes().isEmpty());
        }

        @Test
        @DisplayName("completed passes append to the history")
        void historyGrows() {
            var first = pending().completedPass(List.of(outcome(1, 0), outcome(1, 1)), "step 2 returned no data");
            var second = first.withRetryFeedback("look at the routes")
                    .completedPass(List.of(outcome(2, 0)), null);

            assertEquals(2, first.stepOutcomes().size());
            assertEquals(3, second.stepOutcomes().size());
            assertEquals(2, second.attempts());
            assertEquals("look at the routes", second.retryFeedback());
            assertEquals(1, second.outcomesOfAttempt(2).size());
            assertNull(second.limitationsNotes());
        }

        @Test
        @DisplayName("cancelled pass keeps partial outcomes")
        void cancelledPass() {
            var state = pending().cancelledPass(List.of(outcome(1, 0)), "Cancelled before step 2 of 2");
            assertEquals(InvestigationStatus.CANCELLED, state.status());
            assertEquals(1, state.stepOutcomes().size());
            assertEquals(1, state.attempts());
        }

        @Test
        @DisplayName("failed keeps history and records details")
        void failed() {
            var done = pending().completedPass(List.of(outcome(1, 0)), null);
            var state = done.failed("NullPointerException: driver");
            assertEquals(InvestigationStatus.FAILED, state.status());
            assertEquals(1, state.stepOutcomes().size());
            assertEquals("NullPointerException: driver", state.errorDetails());
        }

        @Test
        @DisplayName("history is immutable")
        void immutableHistory() {
            var state = pending().completedPass(List.of(outcome(1, 0)), null);
            assertThrows(UnsupportedOperationException.class, () -> state.stepOutcomes().clear());
        }
    }

    // -- Tool invocations -----------------------------------------------------

    @Nested
    @DisplayName("tool invocations")
    class Invocations {

        private final ToolCallRequest request = new ToolCallRequest("show_bgp", Map.of("vrf", "default"));

        @Test
        @DisplayName("a step with one success and one failure")
        void mixed() {
            var ok = ToolInvocation.succeeded(request, null);
            var bad = ToolInvocation.failed(request, new ToolError(ToolErrorType.COMMUNICATION, "timeout"));
            var step = outcome(1, 0, ok, bad);

            assertTrue(ok.isExecuted());
            assertTrue(ok.isSuccess());
            assertEquals(Map.of(), ok.result());
            assertTrue(bad.isExecuted());
            assertFalse(bad.isSuccess());
            assertTrue(step.hasSuccessfulInvocation());
            assertEquals(List.of(bad), step.failedInvocations());
        }

        @Test
        @DisplayName("a step without invocations has no success")
        void empty() {
            assertFalse(outcome(1, 1).hasSuccessfulInvocation());
        }
    }
}
