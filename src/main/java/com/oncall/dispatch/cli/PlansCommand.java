package com.oncall.dispatch.cli;

import com.oncall.core.model.InvestigationPlan;
import com.oncall.core.plan.PlanRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: oncall plans
 * <p>
 * Lists the investigation plans available to the planner.
 */
@Command(name = "plans", mixinStandardHelpOptions = true, description = "List available investigation plans")
@Component
public class PlansCommand implements Runnable {

    private final PlanRepository planRepository;

    public PlansCommand(PlanRepository planRepository) {
        this.planRepository = planRepository;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<InvestigationPlan> plans = planRepository.catalog();
        if (plans.isEmpty()) {
            ConsoleOutput.error("No investigation plans found.");
            return;
        }

        ConsoleOutput.info("Plans (" + plans.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-6s %s%n", "INTENT", "STEPS", "OBJECTIVE");
        System.out.println("  " + "-".repeat(76));
        for (InvestigationPlan plan : plans) {
            System.out.printf("  %-24s %-6d %s%n", plan.intent(), plan.steps().size(),
                    ConsoleOutput.truncate(plan.objectiveDescription(), 44));
        }
    }
}
