package com.oncall.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything known about one device's investigation within a session.
 * <p>
 * Instances are immutable; a worker produces a new instance per pass and the
 * coordinator merges it back into the session. {@code stepOutcomes} only ever grows.
 *
 * @param deviceName device identifier
 * @param deviceProfile device class or platform
 * @param role the device's role in the network
 * @param intent key of the plan being executed
 * @param objective objective text the results are judged against
 * @param planSteps ordered plan steps
 * @param stepOutcomes outcomes of every pass so far, oldest first
 * @param limitationsNotes summary of failed or empty steps from the latest pass, or null
 * @param retryFeedback assessor guidance for the next pass, or null
 * @param status lifecycle status
 * @param attempts number of passes run so far
 * @param errorDetails reason the last pass failed outright, or null
 */
public record DeviceInvestigationState(
    String deviceName,
    String deviceProfile,
    String role,
    String intent,
    String objective,
    List<String> planSteps,
    List<StepOutcome> stepOutcomes,
    String limitationsNotes,
    String retryFeedback,
    InvestigationStatus status,
    int attempts,
    String errorDetails
) implements Serializable {

    public DeviceInvestigationState {
        planSteps = List.copyOf(planSteps);
        stepOutcomes = List.copyOf(stepOutcomes);
    }

    /**
     * Initial state for a device that has a plan but no history.
     */
    public static DeviceInvestigationState pending(TargetDevice device, InvestigationPlan plan, String objective) {
        return new DeviceInvestigationState(
                device.deviceName(), device.deviceProfile(), device.role(),
                plan.intent(), objective, plan.steps(), List.of(),
                null, null, InvestigationStatus.PENDING, 0, null);
    }

    /**
     * Result of a finished pass: the new outcomes are appended to the existing history.
     */
    public DeviceInvestigationState completedPass(List<StepOutcome> newOutcomes, String limitations) {
        var history = new ArrayList<>(stepOutcomes);
        history.addAll(newOutcomes);
        return new DeviceInvestigationState(deviceName, deviceProfile, role, intent, objective, planSteps,
                history, limitations, retryFeedback, InvestigationStatus.COMPLETED, attempts + 1, null);
    }

    /**
     * Result of a pass that stopped early on cancellation; partial outcomes are kept.
     */
    public DeviceInvestigationState cancelledPass(List<StepOutcome> partialOutcomes, String limitations) {
        var history = new ArrayList<>(stepOutcomes);
        history.addAll(partialOutcomes);
        return new DeviceInvestigationState(deviceName, deviceProfile, role, intent, objective, planSteps,
                history, limitations, retryFeedback, InvestigationStatus.CANCELLED, attempts + 1, null);
    }

    /**
     * Same history, marked as failed by an unrecoverable worker error.
     */
    public DeviceInvestigationState failed(String details) {
        return new DeviceInvestigationState(deviceName, deviceProfile, role, intent, objective, planSteps,
                stepOutcomes, limitationsNotes, retryFeedback, InvestigationStatus.FAILED, attempts + 1, details);
    }

    public DeviceInvestigationState cancelled() {
        return new DeviceInvestigationState(deviceName, deviceProfile, role, intent, objective, planSteps,
                stepOutcomes, limitationsNotes, retryFeedback, InvestigationStatus.CANCELLED, attempts, errorDetails);
    }

    public DeviceInvestigationState withRetryFeedback(String feedback) {
        return new DeviceInvestigationState(deviceName, deviceProfile, role, intent, objective, planSteps,
                stepOutcomes, limitationsNotes, feedback, status, attempts, errorDetails);
    }

    /**
     * Outcomes produced by the given pass only.
     */
    public List<StepOutcome> outcomesOfAttempt(int attempt) {
        return stepOutcomes.stream().filter(o -> o.attempt() == attempt).toList();
    }
}
