package com.conduit.controller;

import com.conduit.model.CacheHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;

/**
 * Request id resolution shared by the completion endpoint and the error handler:
 * the client's {@code x-request-id} header when present, otherwise the server's own request id.
 */
final class RequestIds {

    private RequestIds() {
    }

    static String resolve(ServerHttpRequest request) {
        String header = request.getHeaders().getFirst(CacheHeaders.REQUEST_ID);
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        return request.getId();
    }
}
