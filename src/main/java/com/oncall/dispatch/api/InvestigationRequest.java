package com.oncall.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/investigations.
 *
 * @param query          natural-language investigation query
 * @param maxRetries     retry bound override; nullable, defaults to configuration
 * @param timeoutSeconds session timeout override; nullable, defaults to configuration
 */
public record InvestigationRequest(
    String query,
    @JsonProperty("max_retries") Integer maxRetries,
    @JsonProperty("timeout_seconds") Long timeoutSeconds
) {}
