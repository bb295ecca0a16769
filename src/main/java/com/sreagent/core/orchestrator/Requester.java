package com.sreagent.core.orchestrator;

import com.sreagent.core.model.ChatReply;

/**
 * Whoever asked: receives the formatted reply to its utterance.
 */
@FunctionalInterface
public interface Requester {

    Requester NONE = reply -> { };

    void reply(ChatReply reply);
}
