package io.github.shedder.servlet;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

/**
 * Writes the response for a request the load shedder rejected.
 */
@FunctionalInterface
public interface RejectionHandler {

    /**
     * Plain {@code 503 Service Unavailable}; the request body is never read.
     */
    RejectionHandler SERVICE_UNAVAILABLE = (request, response) ->
        response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE);

    void reject(HttpServletRequest request, HttpServletResponse response) throws IOException;
}
