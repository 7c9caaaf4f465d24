package com.sonarrmcp.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The raw upstream answer: the status code and the parsed body.
 *
 * @param status The HTTP status code.
 * @param body   The body parsed as JSON; a text node when the body was not JSON, a null node when it was empty.
 */
public record UpstreamResponse(int status, JsonNode body) {

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
