package com.oncall.core.report;

import com.oncall.core.state.InvestigationState;

/**
 * Produces the final human-readable summary of a session.
 */
public interface ReportSynthesizer {

    String synthesize(InvestigationState state);
}
