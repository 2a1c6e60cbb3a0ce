package com.oncall.core.llm;

import com.oncall.core.error.InvestigationException;

/**
 * Thrown when the model returns null or blank content instead of a valid response.
 */
public class LlmEmptyResponseException extends InvestigationException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
