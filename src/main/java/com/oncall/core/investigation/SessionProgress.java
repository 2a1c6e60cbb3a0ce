package com.oncall.core.investigation;

import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.InvestigationStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running record of a session's device states, updated as each step finishes.
 * <p>
 * The graph only publishes state between nodes, so a session interrupted mid-pass would
 * otherwise lose the steps its workers already completed. Workers write here directly;
 * the engine reads it back when it has to build a result without the graph.
 */
public final class SessionProgress {

    private final Map<String, DeviceInvestigationState> devices = new LinkedHashMap<>();
    private int executionPasses;

    public synchronized void recordAll(Map<String, DeviceInvestigationState> states) {
        devices.putAll(states);
    }

    public synchronized void record(DeviceInvestigationState state) {
        devices.put(state.deviceName(), state);
    }

    public synchronized void recordPass(int pass) {
        executionPasses = Math.max(executionPasses, pass);
    }

    public synchronized DeviceInvestigationState device(String deviceName) {
        return devices.get(deviceName);
    }

    /**
     * Copy of every recorded device, with devices that never got to run marked cancelled.
     */
    public synchronized Map<String, DeviceInvestigationState> cancelledDevices() {
        var copy = new LinkedHashMap<String, DeviceInvestigationState>();
        devices.forEach((name, state) -> copy.put(name,
                state.status() == InvestigationStatus.PENDING ? state.cancelled() : state));
        return copy;
    }

    public synchronized int executionPasses() {
        return executionPasses;
    }
}
