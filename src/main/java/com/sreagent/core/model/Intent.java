package com.sreagent.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routing decision for one operator utterance.
 *
 * @param workerKind the requested worker kind as named by the classifier; may be unrecognized
 * @param action     the action to run
 * @param params     action parameters, never null
 * @param reasoning  one-sentence explanation of the routing
 */
public record Intent(
    @JsonProperty("agent") String workerKind,
    String action,
    Map<String, Object> params,
    String reasoning
) {
    public Intent {
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
        reasoning = reasoning != null ? reasoning : "";
    }
}
