package com.oncall.core.oracle;

import com.oncall.core.model.ToolCallRequest;

import java.util.List;

/**
 * Turns a natural-language plan step into concrete tool calls.
 */
public interface ReasoningOracle {

    /**
     * @return the calls to make for this step, in order; empty when no tool fits
     */
    List<ToolCallRequest> propose(OracleRequest request);
}
