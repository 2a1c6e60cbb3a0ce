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
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} of an investigation session.
 * <pre>
 *   START -> validate_input -> plan_investigations -> execute_investigations
 *         -> [routeAfterExecution]
 *            -> cancel_session -> END
 *            -> assess_objective -> [routeAfterAssessment]
 *               -> execute_investigations  (retry with feedback)
 *               -> generate_report -> END
 * </pre>
 * The assessor's retry bound limits a session to {@code maxRetries + 1} execution passes.
 * Each pass costs two node steps, so the compiled graph's iteration limit is raised per
 * retry bound where the configured limit would cut a session short.
 */
@Component
public class InvestigationGraph {

    private static final Logger log = LoggerFactory.getLogger(InvestigationGraph.class);

    static final String VALIDATE = "validate_input";
    static final String PLAN = "plan_investigations";
    static final String EXECUTE = "execute_investigations";
    static final String ASSESS = "assess_objective";
    static final String REPORT = "generate_report";
    static final String CANCEL = "cancel_session";

    private final StateGraph<InvestigationState> stateGraph;
    private final BaseCheckpointSaver checkpointSaver;
    private final int configuredLimit;
    private final Map<Integer, CompiledGraph<InvestigationState>> compiledByLimit = new ConcurrentHashMap<>();

    public InvestigationGraph(
            ValidateInputNode validateNode,
            PlanInvestigationsNode planNode,
            ExecuteInvestigationsNode executeNode,
            AssessObjectiveNode assessNode,
            GenerateReportNode reportNode,
            CancelSessionNode cancelNode,
            InvestigatorProperties properties,
            @Autowired(required = false) BaseCheckpointSaver checkpointSaver) throws Exception {

        this.stateGraph = new StateGraph<>(InvestigationState.SCHEMA, InvestigationState::new)
                .addNode(VALIDATE, node_async(validateNode::apply))
                .addNode(PLAN, node_async(planNode::apply))
                .addNode(EXECUTE, node_async(executeNode::apply))
                .addNode(ASSESS, node_async(assessNode::apply))
                .addNode(REPORT, node_async(reportNode::apply))
                .addNode(CANCEL, node_async(cancelNode::apply))
                .addEdge(START, VALIDATE)
                .addEdge(VALIDATE, PLAN)
                .addEdge(PLAN, EXECUTE)
                .addConditionalEdges(EXECUTE,
                        edge_async(this::routeAfterExecution),
                        Map.of(ASSESS, ASSESS, CANCEL, CANCEL))
                .addConditionalEdges(ASSESS,
                        edge_async(this::routeAfterAssessment),
                        Map.of(EXECUTE, EXECUTE, REPORT, REPORT))
                .addEdge(REPORT, END)
                .addEdge(CANCEL, END);

        this.checkpointSaver = checkpointSaver;
        this.configuredLimit = properties.getGraph().getRecursionLimit();
        if (checkpointSaver != null) {
            log.info("Graph uses checkpoint saver: {}", checkpointSaver.getClass().getSimpleName());
        } else {
            log.info("Graph runs without checkpoint saver");
        }
        compiledByLimit.put(configuredLimit, compile(configuredLimit));
    }

    /**
     * Node steps a session with the given retry bound may take: validation, planning,
     * {@code maxRetries + 1} execute/assess pairs and the final report or cancel node,
     * with some headroom.
     */
    static int iterationsFor(int maxRetries) {
        return 2 * (maxRetries + 1) + 6;
    }

    private CompiledGraph<InvestigationState> compile(int recursionLimit) {
        var configBuilder = CompileConfig.builder().recursionLimit(recursionLimit);
        if (checkpointSaver != null) {
            configBuilder.checkpointSaver(checkpointSaver);
        }
        try {
            return stateGraph.compile(configBuilder.build());
        } catch (Exception e) {
            throw new IllegalStateException("Failed to compile investigation graph: " + e.getMessage(), e);
        }
    }

    String routeAfterExecution(InvestigationState state) {
        if (state.status() == SessionStatus.CANCELLED) {
            return CANCEL;
        }
        return ASSESS;
    }

    /**
     * Loops back to execution only while the objective is unmet and retries remain.
     */
    String routeAfterAssessment(InvestigationState state) {
        if (state.objectiveStatus() == ObjectiveStatus.ACHIEVED) {
            return REPORT;
        }
        if (state.currentRetryCount() > state.maxRetries()) {
            log.error("Retry count {} exceeds bound {}, reporting", state.currentRetryCount(), state.maxRetries());
            return REPORT;
        }
        return EXECUTE;
    }

    public CompiledGraph<InvestigationState> getCompiledGraph() {
        return compiledByLimit.get(configuredLimit);
    }

    /**
     * Compiled graph whose iteration limit fits a session with the given retry bound.
     */
    public CompiledGraph<InvestigationState> getCompiledGraph(int maxRetries) {
        int limit = Math.max(configuredLimit, iterationsFor(maxRetries));
        return compiledByLimit.computeIfAbsent(limit, this::compile);
    }
}
