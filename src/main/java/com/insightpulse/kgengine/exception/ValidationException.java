package com.insightpulse.kgengine.exception;

/**
 * Malformed input: blank or badly formed slug, unknown type tag, bad property value, bad vector.
 */
public class ValidationException extends KnowledgeGraphException {

    public ValidationException(String message) {
        super(message);
    }
}
