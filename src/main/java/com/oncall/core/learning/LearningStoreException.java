package com.oncall.core.learning;

import com.oncall.core.error.InvestigationException;

public class LearningStoreException extends InvestigationException {
    public LearningStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
