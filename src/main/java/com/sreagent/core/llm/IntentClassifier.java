package com.sreagent.core.llm;

import com.sreagent.core.model.Intent;

/**
 * Routes an operator utterance to a worker kind and action.
 */
public interface IntentClassifier {

    /**
     * @param utterance the operator's text
     * @return the routing decision; its worker kind may be one the orchestrator does not know
     * @throws RuntimeException when no decision can be produced
     */
    Intent classify(String utterance);
}
