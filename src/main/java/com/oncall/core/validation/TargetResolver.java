package com.oncall.core.validation;

import com.oncall.core.model.TargetDevice;

import java.util.List;

/**
 * Resolves the devices a query is about.
 */
public interface TargetResolver {

    /**
     * @return the referenced devices in query order, without duplicates; empty when none matched
     */
    List<TargetDevice> resolve(String userQuery, String learnedContext);
}
