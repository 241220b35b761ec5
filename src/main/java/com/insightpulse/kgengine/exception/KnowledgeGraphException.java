package com.insightpulse.kgengine.exception;

/**
 * Root of every failure the engine reports to its callers.
 */
public abstract class KnowledgeGraphException extends RuntimeException {

    protected KnowledgeGraphException(String message) {
        super(message);
    }

    protected KnowledgeGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
