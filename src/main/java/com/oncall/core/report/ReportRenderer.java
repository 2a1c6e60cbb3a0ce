package com.oncall.core.report;

import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.InvestigationStatus;
import com.oncall.core.state.InvestigationState;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic Markdown rendering of a session.
 * <p>
 * Serves as the context handed to the report model, as the fallback report when the
 * model is unavailable, and as the summary of cancelled sessions.
 */
@Component
public class ReportRenderer {

    static final int MAX_RESULT_CHARS = 800;

    public String render(InvestigationState state) {
        return render(state, "Investigation Report");
    }

    public String render(InvestigationState state, String title) {
        Map<String, DeviceInvestigationState> devices = state.devices();
        Map<String, String> resolved = state.resolvedDevices();
        var sb = new StringBuilder();

        sb.append("# ").append(title).append("\n\n");
        sb.append("**Query:** ").append(state.userQuery()).append("\n\n");

        sb.append("## Overview\n");
        sb.append("- Session: ").append(state.sessionId()).append("\n");
        sb.append("- Objective status: ").append(state.objectiveStatus());
        if (state.forcedAcceptance()) {
            sb.append(" (accepted at retry bound)");
        }
        sb.append("\n");
        appendCounts(sb, devices.values());
        sb.append("- Execution passes: ").append(state.executionPasses()).append("\n");
        sb.append("- Retry attempts: ").append(state.currentRetryCount()).append("/").append(state.maxRetries())
          .append("\n\n");

        sb.append("## Device Investigation Results\n");
        if (devices.isEmpty()) {
            sb.append("No device investigations were started.\n");
        }
        for (DeviceInvestigationState device : devices.values()) {
            sb.append(OutcomeFormatter.describeDevice(device, MAX_RESULT_CHARS));
            String resolution = resolved.get(device.deviceName());
            if (resolution != null) {
                sb.append("- Resolution: ").append(resolution).append("\n");
            } else if (device.retryFeedback() != null) {
                sb.append("- Outstanding feedback: ").append(device.retryFeedback()).append("\n");
            }
            sb.append("\n");
        }

        sb.append("## Assessment\n");
        String notes = state.assessorNotes();
        sb.append(notes.isBlank() ? "No assessment was completed.\n" : notes.strip() + "\n");

        if (!state.errors().isEmpty()) {
            sb.append("\n## Errors\n");
            state.errors().forEach(e -> sb.append("- ").append(e).append("\n"));
        }

        sb.append("\n## Historical Context\n");
        String history = state.learnedContext();
        sb.append(history.isBlank() ? "No previous sessions recorded.\n" : history.strip() + "\n");
        return sb.toString();
    }

    /**
     * Partial report of a cancelled session, ending with why it was stopped.
     */
    public String renderCancelled(InvestigationState state, String reason) {
        String report = render(state, "Investigation Cancelled");
        return reason == null || reason.isBlank() ? report : report + "\n_Reason: " + reason + "_\n";
    }

    private static void appendCounts(StringBuilder sb, Collection<DeviceInvestigationState> devices) {
        long completed = devices.stream().filter(d -> d.status() == InvestigationStatus.COMPLETED).count();
        long failed = devices.stream().filter(d -> d.status() == InvestigationStatus.FAILED).count();
        long cancelled = devices.stream().filter(d -> d.status() == InvestigationStatus.CANCELLED).count();
        double rate = devices.isEmpty() ? 0.0 : (double) completed / devices.size();
        sb.append("- Devices investigated: ").append(devices.size()).append("\n");
        sb.append("- Completed: ").append(completed).append(", failed: ").append(failed)
          .append(", cancelled: ").append(cancelled).append("\n");
        sb.append("- Success rate: ").append(String.format(Locale.ROOT, "%.1f%%", rate * 100)).append("\n");
    }
}
