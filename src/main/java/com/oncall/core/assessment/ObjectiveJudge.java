package com.oncall.core.assessment;

import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.ObjectiveJudgement;

/**
 * Decides whether one device's gathered results satisfy its objective.
 */
public interface ObjectiveJudge {

    ObjectiveJudgement judge(String userQuery, DeviceInvestigationState device, String learnedContext);
}
