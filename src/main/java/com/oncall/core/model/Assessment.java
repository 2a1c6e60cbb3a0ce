package com.oncall.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Outcome of one assessment pass.
 *
 * @param objectiveAchieved true when the session may proceed to reporting
 * @param feedbackPerDevice retry guidance keyed by device name, only for devices that need another pass
 * @param resolutions reason each settled device needs no further pass, keyed by device name
 * @param notes assessor notes carried into the report
 * @param forced true when acceptance was forced by the retry bound
 */
public record Assessment(
    boolean objectiveAchieved,
    Map<String, String> feedbackPerDevice,
    Map<String, String> resolutions,
    String notes,
    boolean forced
) implements Serializable {

    public Assessment {
        feedbackPerDevice = Map.copyOf(feedbackPerDevice);
        resolutions = Map.copyOf(resolutions);
    }
}
