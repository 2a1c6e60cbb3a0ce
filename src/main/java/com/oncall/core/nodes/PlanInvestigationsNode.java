package com.oncall.core.nodes;

import com.oncall.core.config.InvestigatorProperties;
import com.oncall.core.error.InvestigationException;
import com.oncall.core.error.PlanDocumentException;
import com.oncall.core.events.EventBus;
import com.oncall.core.events.InvestigationEvent;
import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.InvestigationPlan;
import com.oncall.core.model.SessionStatus;
import com.oncall.core.model.TargetDevice;
import com.oncall.core.plan.PlanChoice;
import com.oncall.core.plan.PlanRepository;
import com.oncall.core.plan.PlanSelector;
import com.oncall.core.state.InvestigationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks a plan per target device and creates the initial device investigations.
 * <p>
 * A device the selector leaves without a plan falls back to the configured default intent;
 * without one the session fails. Unknown or malformed plans always fail the session.
 */
@Component
public class PlanInvestigationsNode {

    private static final Logger log = LoggerFactory.getLogger(PlanInvestigationsNode.class);

    private final PlanRepository planRepository;
    private final PlanSelector planSelector;
    private final InvestigatorProperties properties;
    private final EventBus eventBus;

    public PlanInvestigationsNode(PlanRepository planRepository, PlanSelector planSelector,
                                  InvestigatorProperties properties, EventBus eventBus) {
        this.planRepository = planRepository;
        this.planSelector = planSelector;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(InvestigationState state) {
        List<TargetDevice> targets = state.targets();
        List<InvestigationPlan> catalog = planRepository.catalog();
        if (catalog.isEmpty()) {
            throw new PlanDocumentException("No investigation plans available");
        }
        String defaultIntent = properties.getPlans().getDefaultIntent();
        boolean hasDefault = defaultIntent != null && !defaultIntent.isBlank();

        Map<String, PlanChoice> choices;
        try {
            choices = planSelector.select(state.userQuery(), targets, catalog, state.learnedContext());
        } catch (RuntimeException e) {
            if (!hasDefault) {
                throw e instanceof InvestigationException ie ? ie
                        : new InvestigationException("Plan selection failed: " + e.getMessage(), e);
            }
            log.warn("Plan selection failed, using default intent '{}': {}", defaultIntent, e.getMessage());
            choices = Map.of();
        }

        var devices = new LinkedHashMap<String, DeviceInvestigationState>();
        for (TargetDevice target : targets) {
            PlanChoice choice = choices.get(target.deviceName());
            String intent;
            if (choice != null) {
                intent = choice.intent();
            } else if (hasDefault) {
                intent = defaultIntent;
            } else {
                throw new PlanDocumentException("No plan selected for device " + target.deviceName());
            }
            InvestigationPlan plan = planRepository.load(intent);
            String objective = choice != null && choice.objective() != null && !choice.objective().isBlank()
                    ? choice.objective().trim() : plan.objectiveDescription();
            devices.put(target.deviceName(), DeviceInvestigationState.pending(target, plan, objective));
            log.info("Device {} -> plan '{}' ({} step(s))", target.deviceName(), intent, plan.steps().size());
        }

        var planned = new LinkedHashMap<String, Object>();
        devices.values().forEach(d -> planned.put(d.deviceName(), d.intent()));
        eventBus.publish(InvestigationEvent.of("session.planned", state.sessionId(), null, planned));

        return Map.of(
                "devices", devices,
                "status", SessionStatus.EXECUTING.name()
        );
    }
}
