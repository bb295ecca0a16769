package com.sreagent.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for the query endpoints.
 *
 * @param message  the operator's utterance
 * @param clientId live stream to deliver the reply to; required for async queries, ignored otherwise
 */
public record QueryRequest(
    String message,
    @JsonProperty("client_id") String clientId
) {}
