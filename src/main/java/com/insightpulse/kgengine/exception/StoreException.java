package com.insightpulse.kgengine.exception;

/**
 * The backing transactional store was unavailable or rejected the operation.
 * Not retried by the engine.
 */
public class StoreException extends KnowledgeGraphException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
