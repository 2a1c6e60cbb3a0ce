package com.oncall.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A predefined investigation recipe loaded from a plan document.
 *
 * @param intent unique plan key, equal to the document's file name without extension
 * @param objectiveDescription what a successful investigation must establish
 * @param steps ordered natural-language instructions, never empty
 */
public record InvestigationPlan(
    String intent,
    String objectiveDescription,
    List<String> steps
) implements Serializable {

    public InvestigationPlan {
        steps = List.copyOf(steps);
    }
}
