package com.pmsuite.orchestrator.proxy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Successful (2xx) backend response.
 */
public record ProxyResponse(BackendService backend, int statusCode, String body) {

    public JsonNode bodyAsJson(ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(backend.serviceName() + " returned a body that is not JSON", e);
        }
    }
}
