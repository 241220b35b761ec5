package com.insightpulse.kgengine.exception;

public class NotFoundException extends KnowledgeGraphException {

    public NotFoundException(String message) {
        super(message);
    }
}
