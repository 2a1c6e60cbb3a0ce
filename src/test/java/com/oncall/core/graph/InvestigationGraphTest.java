package com.oncall.core.graph;

import com.oncall.core.config.InvestigatorProperties;
import com.oncall.core.model.ObjectiveStatus;
import com.oncall.core.model.SessionStatus;
import com.oncall.core.nodes.AssessObjectiveNode;
import com.oncall.core.nodes.CancelSessionNode;
import com.oncall.core.nodes.ExecuteInvestigationsNode;
import com.oncall.core.nodes.GenerateReportNode;
import com.oncall.core.nodes.PlanInvestigationsNode;
import com.oncall.core.nodes.ValidateInputNode;
import com.oncall.core.state.InvestigationState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Routing decisions of the investigation graph.
 */
class InvestigationGraphTest {

    private InvestigationGraph graph;

    @BeforeEach
    void setUp() throws Exception {
        graph = new InvestigationGraph(
                mock(ValidateInputNode.class),
                mock(PlanInvestigationsNode.class),
                mock(ExecuteInvestigationsNode.class),
                mock(AssessObjectiveNode.class),
                mock(GenerateReportNode.class),
                mock(CancelSessionNode.class),
                new InvestigatorProperties(),
                null);
    }

    @Test
    @DisplayName("compiles without a checkpoint saver")
    void compiles() {
        assertNotNull(graph.getCompiledGraph());
    }

    @Test
    @DisplayName("small retry bounds reuse the default graph, large ones get a wider iteration limit")
    void compiledPerRetryBound() {
        assertSame(graph.getCompiledGraph(), graph.getCompiledGraph(3));
        assertSame(graph.getCompiledGraph(200), graph.getCompiledGraph(200));
        assertNotSame(graph.getCompiledGraph(), graph.getCompiledGraph(200));
        assertTrue(InvestigationGraph.iterationsFor(200) > 2 * 201 + 2);
    }

    // -- After execution ------------------------------------------------------

    @Nested
    @DisplayName("routeAfterExecution")
    class AfterExecution {

        @Test
        @DisplayName("cancelled session goes to cancel_session")
        void cancelled() {
            var state = new InvestigationState(Map.of("status", SessionStatus.CANCELLED.name()));
            assertEquals(InvestigationGraph.CANCEL, graph.routeAfterExecution(state));
        }

        @Test
        @DisplayName("otherwise assess")
        void assess() {
            var state = new InvestigationState(Map.of("status", SessionStatus.EXECUTING.name()));
            assertEquals(InvestigationGraph.ASSESS, graph.routeAfterExecution(state));
        }
    }

    // -- After assessment -----------------------------------------------------

    @Nested
    @DisplayName("routeAfterAssessment")
    class AfterAssessment {

        @Test
        @DisplayName("achieved objective goes to the report")
        void achieved() {
            var state = new InvestigationState(Map.of(
                    "objectiveStatus", ObjectiveStatus.ACHIEVED.name(),
                    "currentRetryCount", 1, "maxRetries", 3));
            assertEquals(InvestigationGraph.REPORT, graph.routeAfterAssessment(state));
        }

        @Test
        @DisplayName("unmet objective with retries left loops back to execution")
        void retry() {
            var state = new InvestigationState(Map.of(
                    "objectiveStatus", ObjectiveStatus.NOT_ACHIEVED.name(),
                    "currentRetryCount", 3, "maxRetries", 3));
            assertEquals(InvestigationGraph.EXECUTE, graph.routeAfterAssessment(state));
        }

        @Test
        @DisplayName("retry count past the bound never loops")
        void pastBound() {
            var state = new InvestigationState(Map.of(
                    "objectiveStatus", ObjectiveStatus.NOT_ACHIEVED.name(),
                    "currentRetryCount", 4, "maxRetries", 3));
            assertEquals(InvestigationGraph.REPORT, graph.routeAfterAssessment(state));
        }
    }
}
