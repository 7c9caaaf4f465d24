package com.sonarrmcp.service.api;

import com.sonarrmcp.model.UpstreamRequest;
import com.sonarrmcp.model.UpstreamResponse;

/**
 * Issues authenticated HTTP calls against the upstream API.
 */
public interface UpstreamClient {

    /**
     * Executes one request and waits for its answer, whatever the status code.
     *
     * @param request The request to send.
     * @return The status code and parsed body.
     * @throws com.sonarrmcp.exception.UpstreamException if no answer arrived (connection failure or timeout).
     */
    UpstreamResponse execute(UpstreamRequest request);
}
