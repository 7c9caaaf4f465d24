package com.sonarrmcp.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.model.Invocation;

public interface ToolDispatcher {

    /**
     * Validates an invocation, sends it to the upstream API and returns the simplified payload.
     *
     * @param index      The catalog the tool is looked up in.
     * @param invocation The tool name and its arguments.
     * @return The simplified upstream payload.
     * @throws com.sonarrmcp.exception.ToolNotFoundException       if the tool does not exist.
     * @throws com.sonarrmcp.exception.ArgumentValidationException if the arguments do not fit the tool.
     * @throws com.sonarrmcp.exception.UpstreamException           if the upstream call fails.
     */
    JsonNode dispatch(CatalogIndex index, Invocation invocation);
}
