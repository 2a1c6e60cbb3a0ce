package com.oncall.core.plan;

import com.oncall.core.model.InvestigationPlan;
import com.oncall.core.model.TargetDevice;

import java.util.List;
import java.util.Map;

/**
 * Chooses which plan to run against each device.
 */
public interface PlanSelector {

    /**
     * @return choices keyed by device name; devices without a usable choice are absent
     */
    Map<String, PlanChoice> select(String userQuery, List<TargetDevice> devices,
                                   List<InvestigationPlan> catalog, String learnedContext);
}
