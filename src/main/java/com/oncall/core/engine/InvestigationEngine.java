package com.oncall.core.engine;

import com.oncall.core.config.InvestigatorProperties;
import com.oncall.core.error.InvestigationException;
import com.oncall.core.events.EventBus;
import com.oncall.core.events.InvestigationEvent;
import com.oncall.core.graph.InvestigationGraph;
import com.oncall.core.investigation.CancellationRegistry;
import com.oncall.core.investigation.CancellationToken;
import com.oncall.core.investigation.SessionProgress;
import com.oncall.core.logging.MdcContext;
import com.oncall.core.metrics.InvestigationMetrics;
import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.ObjectiveStatus;
import com.oncall.core.model.SessionStatus;
import com.oncall.core.report.ReportRenderer;
import com.oncall.core.state.InvestigationState;
import jakarta.annotation.PreDestroy;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for investigation sessions.
 * <p>
 * Each session runs the compiled graph on its own thread while the caller waits up to the
 * session timeout. On timeout or {@link #cancel} the session's token is cancelled so workers
 * stop between steps; if the graph has not finished after the grace period the thread is
 * interrupted and the result is built from the latest state snapshot merged with the
 * steps workers recorded since. Fatal errors
 * ({@link InvestigationException}) reach the caller unwrapped.
 */
@Service
public class InvestigationEngine {

    private static final Logger log = LoggerFactory.getLogger(InvestigationEngine.class);
    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(200);
    private static final int MAX_TRACKED_SESSIONS = 200;
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final InvestigationGraph graph;
    private final CancellationRegistry cancellations;
    private final ReportRenderer renderer;
    private final EventBus eventBus;
    private final InvestigationMetrics metrics;
    private final InvestigatorProperties properties;

    private final ExecutorService sessionThreads = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "investigation-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    /** Sessions started through {@link #submitAsync}, oldest evicted first. */
    private final Map<String, TrackedSession> tracked = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, TrackedSession> eldest) {
            return size() > MAX_TRACKED_SESSIONS && eldest.getValue().result().isDone();
        }
    };

    private record TrackedSession(AtomicReference<InvestigationState> latest,
                                  CompletableFuture<InvestigationResult> result) {}

    public InvestigationEngine(InvestigationGraph graph, CancellationRegistry cancellations,
                               ReportRenderer renderer, EventBus eventBus,
                               InvestigationMetrics metrics, InvestigatorProperties properties) {
        this.graph = graph;
        this.cancellations = cancellations;
        this.renderer = renderer;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Runs a session with the configured defaults and waits for it.
     */
    public InvestigationResult submit(String userQuery) {
        return submit(userQuery, SessionOptions.defaults(properties));
    }

    public InvestigationResult submit(String userQuery, SessionOptions options) {
        return run(generateSessionId(), userQuery, options, new AtomicReference<>());
    }

    /**
     * Starts a session in the background.
     *
     * @return the session id, usable with {@link #status} and {@link #cancel}
     */
    public String submitAsync(String userQuery, SessionOptions options) {
        String sessionId = generateSessionId();
        var latest = new AtomicReference<InvestigationState>();
        var result = new CompletableFuture<InvestigationResult>();
        synchronized (tracked) {
            tracked.put(sessionId, new TrackedSession(latest, result));
        }
        sessionThreads.submit(() -> {
            try {
                result.complete(run(sessionId, userQuery, options, latest));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return sessionId;
    }

    /**
     * Latest known state of a session started with {@link #submitAsync}.
     *
     * @throws InvestigationException if the session ended with a fatal error
     */
    public Optional<InvestigationResult> status(String sessionId) {
        TrackedSession session;
        synchronized (tracked) {
            session = tracked.get(sessionId);
        }
        if (session == null) {
            return Optional.empty();
        }
        if (session.result().isDone()) {
            try {
                return Optional.of(session.result().join());
            } catch (RuntimeException e) {
                throw rethrowFatal(e.getCause() != null ? e.getCause() : e);
            }
        }
        InvestigationState snapshot = session.latest().get();
        return Optional.of(snapshot != null
                ? InvestigationResult.from(snapshot)
                : new InvestigationResult(sessionId, "", SessionStatus.VALIDATING, ObjectiveStatus.UNKNOWN,
                        "", 0, 0, 0, false, Map.of(), List.of()));
    }

    /**
     * Requests cooperative cancellation of a running session.
     *
     * @return false if the session is not running
     */
    public boolean cancel(String sessionId) {
        boolean cancelled = cancellations.cancel(sessionId, "cancelled on request");
        if (cancelled) {
            log.info("Cancellation requested for session {}", sessionId);
        }
        return cancelled;
    }

    InvestigationResult run(String sessionId, String userQuery, SessionOptions options,
                            AtomicReference<InvestigationState> latest) {
        MdcContext.setSession(sessionId);
        long start = System.currentTimeMillis();
        CancellationToken token = cancellations.register(sessionId);
        String outcome = "FAILED";
        try {
            log.info("Session {} started: \"{}\" (max retries {}, timeout {})",
                    sessionId, userQuery, options.maxRetries(), options.timeout());
            eventBus.publish(InvestigationEvent.of("session.created", sessionId, null,
                    Map.of("query", userQuery, "maxRetries", options.maxRetries())));

            Map<String, Object> initialState = Map.of(
                    "sessionId", sessionId,
                    "userQuery", userQuery,
                    "maxRetries", options.maxRetries(),
                    "status", SessionStatus.VALIDATING.name()
            );
            latest.set(new InvestigationState(initialState));

            Future<InvestigationState> execution = sessionThreads.submit(
                    () -> runGraph(sessionId, initialState, options.maxRetries(), latest));
            InvestigationState finalState = awaitSession(sessionId, execution, token, options.timeout());
            InvestigationResult result = finalState != null
                    ? InvestigationResult.from(finalState)
                    : cancelledResult(latest.get(), cancellations.progressFor(sessionId), token);

            outcome = result.objectiveStatus().name();
            metrics.recordExecutionPasses(result.executionPasses());
            log.info("Session {} finished: {} / {} after {} pass(es)",
                    sessionId, result.status(), result.objectiveStatus(), result.executionPasses());
            eventBus.publish(InvestigationEvent.of("session.finished", sessionId, null,
                    Map.of("status", result.status().name(), "objective", outcome)));
            return result;
        } catch (ExecutionException e) {
            throw rethrowFatal(e.getCause());
        } finally {
            metrics.recordSessionResult(outcome);
            metrics.recordSessionDuration(System.currentTimeMillis() - start);
            cancellations.release(sessionId);
            MdcContext.clear();
        }
    }

    private InvestigationState runGraph(String sessionId, Map<String, Object> initialState, int maxRetries,
                                        AtomicReference<InvestigationState> latest) throws Exception {
        MdcContext.setSession(sessionId);
        try {
            var config = RunnableConfig.builder().threadId(sessionId).build();
            InvestigationState finalState = null;
            for (var output : graph.getCompiledGraph(maxRetries).stream(initialState, config)) {
                finalState = output.state();
                latest.set(finalState);
            }
            return finalState;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Waits for the graph, enforcing the timeout and the cancellation grace period.
     *
     * @return the final state, or null if the graph had to be interrupted
     */
    private InvestigationState awaitSession(String sessionId, Future<InvestigationState> execution,
                                            CancellationToken token, Duration timeout) throws ExecutionException {
        long deadline = System.nanoTime() + timeout.toNanos();
        long graceNanos = properties.getCancellationGrace().toNanos();
        long graceDeadline = 0;
        boolean stopping = false;
        try {
            while (true) {
                long now = System.nanoTime();
                if (!stopping && (token.isCancelled() || now - deadline >= 0)) {
                    if (!token.isCancelled()) {
                        log.warn("Session {} exceeded its timeout of {}, cancelling", sessionId, timeout);
                        token.cancel("session timeout after " + timeout);
                    }
                    stopping = true;
                    graceDeadline = now + graceNanos;
                }
                if (stopping && now - graceDeadline >= 0) {
                    log.warn("Session {} did not stop within {}, interrupting", sessionId,
                            properties.getCancellationGrace());
                    execution.cancel(true);
                    return null;
                }
                long waitUntil = stopping ? graceDeadline : deadline;
                long slice = Math.max(1, Math.min(POLL_NANOS, waitUntil - now));
                try {
                    return execution.get(slice, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    log.trace("Session {} still running", sessionId);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel("caller interrupted");
            execution.cancel(true);
            return null;
        }
    }

    private InvestigationResult cancelledResult(InvestigationState snapshot, SessionProgress progress,
                                                CancellationToken token) {
        var data = new HashMap<String, Object>(snapshot.data());
        var devices = new LinkedHashMap<String, DeviceInvestigationState>(snapshot.devices());
        devices.putAll(progress.cancelledDevices());
        data.put("devices", devices);
        data.put("executionPasses", Math.max(snapshot.executionPasses(), progress.executionPasses()));
        data.put("status", SessionStatus.CANCELLED.name());
        data.put("objectiveStatus", ObjectiveStatus.CANCELLED.name());
        data.put("summary", renderer.renderCancelled(new InvestigationState(data), token.reason()));
        return InvestigationResult.from(new InvestigationState(data));
    }

    private static RuntimeException rethrowFatal(Throwable failure) {
        Throwable cause = failure;
        while (cause != null) {
            if (cause instanceof InvestigationException ie) {
                return ie;
            }
            cause = cause.getCause();
        }
        return new InvestigationException("Investigation failed: "
                + (failure != null ? failure.getMessage() : "unknown error"), failure);
    }

    static String generateSessionId() {
        return "INV-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @PreDestroy
    void shutdown() {
        sessionThreads.shutdownNow();
    }
}
