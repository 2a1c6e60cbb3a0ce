package com.oncall.core.state;

import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.ObjectiveStatus;
import com.oncall.core.model.SessionStatus;
import com.oncall.core.model.TargetDevice;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Graph state of one investigation session.
 * <p>
 * {@code devices} is replaced as a whole by each node that touches it; nodes merge
 * their updates into the current map before returning it. {@code errors} is an appender.
 */
public class InvestigationState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("sessionId",         Channels.base(() -> "")),
        Map.entry("userQuery",         Channels.base(() -> "")),
        Map.entry("status",            Channels.base(() -> SessionStatus.VALIDATING.name())),
        Map.entry("maxRetries",        Channels.base(() -> 3)),
        Map.entry("currentRetryCount", Channels.base(() -> 0)),
        Map.entry("executionPasses",   Channels.base(() -> 0)),
        Map.entry("objectiveStatus",   Channels.base(() -> ObjectiveStatus.UNKNOWN.name())),
        Map.entry("assessorNotes",     Channels.base(() -> "")),
        Map.entry("forcedAcceptance",  Channels.base(() -> false)),
        Map.entry("summary",           Channels.base(() -> "")),
        Map.entry("learnedContext",    Channels.base(() -> "")),
        Map.entry("targets",           Channels.base((Supplier<List<TargetDevice>>) List::of)),
        Map.entry("devices",           Channels.base(
                (Supplier<Map<String, DeviceInvestigationState>>) LinkedHashMap::new)),
        Map.entry("resolvedDevices",   Channels.base((Supplier<Map<String, String>>) LinkedHashMap::new)),

        Map.entry("errors",            Channels.appender(ArrayList::new))
    );

    public InvestigationState(Map<String, Object> initData) {
        super(initData);
    }

    public String sessionId() {
        return this.<String>value("sessionId").orElse("");
    }

    public String userQuery() {
        return this.<String>value("userQuery").orElse("");
    }

    public SessionStatus status() {
        String raw = this.<String>value("status").orElse(SessionStatus.VALIDATING.name());
        return SessionStatus.valueOf(raw);
    }

    public int maxRetries() {
        return this.<Integer>value("maxRetries").orElse(3);
    }

    public int currentRetryCount() {
        return this.<Integer>value("currentRetryCount").orElse(0);
    }

    public int executionPasses() {
        return this.<Integer>value("executionPasses").orElse(0);
    }

    public ObjectiveStatus objectiveStatus() {
        String raw = this.<String>value("objectiveStatus").orElse(ObjectiveStatus.UNKNOWN.name());
        return ObjectiveStatus.valueOf(raw);
    }

    public String assessorNotes() {
        return this.<String>value("assessorNotes").orElse("");
    }

    public boolean forcedAcceptance() {
        return this.<Boolean>value("forcedAcceptance").orElse(false);
    }

    public String summary() {
        return this.<String>value("summary").orElse("");
    }

    public String learnedContext() {
        return this.<String>value("learnedContext").orElse("");
    }

    public List<TargetDevice> targets() {
        return this.<List<TargetDevice>>value("targets").orElse(List.of());
    }

    /**
     * Device investigations keyed by device name, in resolution order.
     */
    public Map<String, DeviceInvestigationState> devices() {
        Map<String, DeviceInvestigationState> raw =
                this.<Map<String, DeviceInvestigationState>>value("devices").orElse(Map.of());
        return new LinkedHashMap<>(raw);
    }

    /**
     * Devices that need no further pass, with the reason.
     */
    public Map<String, String> resolvedDevices() {
        Map<String, String> raw = this.<Map<String, String>>value("resolvedDevices").orElse(Map.of());
        return new LinkedHashMap<>(raw);
    }

    /**
     * Devices still awaiting a successful assessment, in resolution order.
     */
    public List<DeviceInvestigationState> unresolvedDevices() {
        Map<String, String> resolved = resolvedDevices();
        return devices().values().stream()
                .filter(d -> !resolved.containsKey(d.deviceName()))
                .toList();
    }

    public List<String> errors() {
        return this.<List<String>>value("errors").orElse(List.of());
    }
}
