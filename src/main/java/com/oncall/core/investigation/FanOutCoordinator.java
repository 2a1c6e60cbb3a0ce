package com.oncall.core.investigation;

import com.oncall.core.config.InvestigatorProperties;
import com.oncall.core.events.EventBus;
import com.oncall.core.events.InvestigationEvent;
import com.oncall.core.logging.MdcContext;
import com.oncall.core.metrics.InvestigationMetrics;
import com.oncall.core.model.DeviceAssignment;
import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.InvestigationStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs device investigations concurrently and merges the results.
 * <p>
 * One worker per device; a semaphore shared by every session caps how many run at
 * once. A worker that throws only fails its own device. Results come back keyed by
 * device name in assignment order.
 */
@Component
public class FanOutCoordinator {

    private static final Logger log = LoggerFactory.getLogger(FanOutCoordinator.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final DeviceInvestigator investigator;
    private final EventBus eventBus;
    private final InvestigationMetrics metrics;
    private final Semaphore permits;
    private final ExecutorService workers;

    @Autowired
    public FanOutCoordinator(DeviceInvestigator investigator, InvestigatorProperties properties,
                             EventBus eventBus, InvestigationMetrics metrics) {
        this(investigator, properties.getMaxConcurrency(), eventBus, metrics);
    }

    FanOutCoordinator(DeviceInvestigator investigator, int maxConcurrency,
                      EventBus eventBus, InvestigationMetrics metrics) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, got " + maxConcurrency);
        }
        this.investigator = investigator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.permits = new Semaphore(maxConcurrency, true);
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "device-worker-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Fan-out coordinator ready (max concurrency: {})", maxConcurrency);
    }

    /**
     * Runs every assignment and waits for all of them.
     * <p>
     * If the calling thread is interrupted while waiting, the token is cancelled, in-flight
     * workers are interrupted, and devices without a result come back marked
     * {@link InvestigationStatus#CANCELLED} with whatever steps they had finished.
     */
    public Map<String, DeviceInvestigationState> runAll(String sessionId, List<DeviceAssignment> assignments,
                                                         CancellationToken token) {
        return runAll(sessionId, assignments, token, new SessionProgress());
    }

    /**
     * As {@link #runAll(String, List, CancellationToken)}, recording every finished step and
     * every device result into {@code progress} as it happens.
     */
    public Map<String, DeviceInvestigationState> runAll(String sessionId, List<DeviceAssignment> assignments,
                                                         CancellationToken token, SessionProgress progress) {
        log.info("Fanning out {} device investigation(s)", assignments.size());

        var futures = new ArrayList<Future<DeviceInvestigationState>>(assignments.size());
        for (DeviceAssignment assignment : assignments) {
            futures.add(workers.submit(() -> runIsolated(sessionId, assignment, token, progress)));
        }

        var results = new LinkedHashMap<String, DeviceInvestigationState>();
        boolean interrupted = false;
        for (int i = 0; i < assignments.size(); i++) {
            DeviceAssignment assignment = assignments.get(i);
            Future<DeviceInvestigationState> future = futures.get(i);
            if (interrupted) {
                results.put(assignment.deviceName(), collectAfterInterrupt(assignment, future, progress));
                continue;
            }
            try {
                results.put(assignment.deviceName(), future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                token.cancel("interrupted");
                log.warn("Fan-out interrupted, cancelling {} in-flight investigation(s)", assignments.size() - i);
                futures.forEach(f -> f.cancel(true));
                results.put(assignment.deviceName(), collectAfterInterrupt(assignment, future, progress));
            } catch (ExecutionException e) {
                // runIsolated never throws; this only covers errors raised by the worker machinery
                log.error("Worker for {} failed: {}", assignment.deviceName(), e.getCause().getMessage(), e.getCause());
                results.put(assignment.deviceName(), assignment.device().failed(String.valueOf(e.getCause())));
            }
        }
        progress.recordAll(results);
        return results;
    }

    private DeviceInvestigationState runIsolated(String sessionId, DeviceAssignment assignment,
                                                 CancellationToken token, SessionProgress progress) {
        String device = assignment.deviceName();
        MdcContext.setDevice(sessionId, device, assignment.attempt());
        long start = System.currentTimeMillis();
        boolean acquired = false;
        try {
            permits.acquire();
            acquired = true;
            if (token.isCancelled()) {
                return assignment.device().cancelled();
            }
            eventBus.publish(InvestigationEvent.of("device.started", sessionId, device,
                    Map.of("attempt", assignment.attempt())));

            DeviceInvestigationState result = investigator.run(assignment, token, progress::record);
            progress.record(result);

            eventBus.publish(InvestigationEvent.of("device.completed", sessionId, device,
                    Map.of("attempt", assignment.attempt(),
                            "status", result.status().name(),
                            "steps", result.outcomesOfAttempt(assignment.attempt()).size())));
            metrics.recordDeviceInvestigation(result.status(), System.currentTimeMillis() - start);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return latestOrCancelled(assignment, progress);
        } catch (Exception e) {
            log.error("Investigation of {} failed: {}", device, e.getMessage(), e);
            DeviceInvestigationState failed = assignment.device().failed(
                    e.getClass().getSimpleName() + ": " + e.getMessage());
            eventBus.publish(InvestigationEvent.of("device.failed", sessionId, device,
                    Map.of("attempt", assignment.attempt(), "error", String.valueOf(e.getMessage()))));
            metrics.recordDeviceInvestigation(InvestigationStatus.FAILED, System.currentTimeMillis() - start);
            progress.record(failed);
            return failed;
        } finally {
            if (acquired) {
                permits.release();
            }
            MdcContext.clear();
        }
    }

    private DeviceInvestigationState collectAfterInterrupt(DeviceAssignment assignment,
                                                           Future<DeviceInvestigationState> future,
                                                           SessionProgress progress) {
        if (future.isDone() && !future.isCancelled()) {
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                return assignment.device().failed(String.valueOf(e.getCause()));
            }
        }
        return latestOrCancelled(assignment, progress);
    }

    /**
     * The device as its worker last reported it during this pass, or its prior state if the
     * worker finished no step.
     */
    private static DeviceInvestigationState latestOrCancelled(DeviceAssignment assignment, SessionProgress progress) {
        DeviceInvestigationState latest = progress.device(assignment.deviceName());
        if (latest != null && latest.attempts() > assignment.device().attempts()) {
            return latest;
        }
        return assignment.device().cancelled();
    }

    int availablePermits() {
        return permits.availablePermits();
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }
}
