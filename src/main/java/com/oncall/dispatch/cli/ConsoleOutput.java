package com.oncall.dispatch.cli;

import com.oncall.core.engine.InvestigationResult;
import com.oncall.core.events.InvestigationEvent;
import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.ObjectiveStatus;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ONCALL INVESTIGATOR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ONCALL]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void device(DeviceInvestigationState device) {
        String color = switch (device.status()) {
            case COMPLETED -> "fg(green)";
            case FAILED -> "fg(red)";
            default -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + device.status() + "|@ " + device.deviceName()
                        + " (" + device.deviceProfile() + ", " + device.intent() + ", "
                        + device.attempts() + " attempt" + (device.attempts() != 1 ? "s" : "") + ")"));
    }

    public static void result(InvestigationResult result) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Session " + result.sessionId() + "|@"));
        for (Map.Entry<String, DeviceInvestigationState> entry : result.devices().entrySet()) {
            device(entry.getValue());
        }
        System.out.println("  Execution passes: " + result.executionPasses()
                + ", retries: " + result.retries() + "/" + result.maxRetries());
        if (result.objectiveStatus() == ObjectiveStatus.ACHIEVED && !result.forcedAcceptance()) {
            success("Objective achieved.");
        } else if (result.objectiveStatus() == ObjectiveStatus.ACHIEVED) {
            info("Objective accepted at the retry bound.");
        } else if (result.objectiveStatus() == ObjectiveStatus.CANCELLED) {
            error("Investigation cancelled.");
        } else {
            info("Objective status: " + result.objectiveStatus());
        }
        for (String e : result.errors()) {
            error("  " + e);
        }
    }

    public static void watchEvent(InvestigationEvent event) {
        String prefix = switch (event.eventType()) {
            case "session.created", "session.validated", "session.planned" -> "@|fg(cyan) [SESSION]|@";
            case "pass.started", "pass.completed" -> "@|bold,fg(yellow) [PASS]|@";
            case "device.started", "device.completed" -> "@|fg(blue) [DEVICE]|@";
            case "device.failed" -> "@|fg(red) [DEVICE]|@";
            case "session.assessed" -> "@|fg(magenta) [ASSESS]|@";
            case "session.reported" -> "@|fg(green) [REPORT]|@";
            case "session.finished" -> "@|fg(green),bold [COMPLETE]|@";
            case "session.cancelled" -> "@|fg(red),bold [CANCELLED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.deviceName() != null ? event.deviceName() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + event.payload()));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
