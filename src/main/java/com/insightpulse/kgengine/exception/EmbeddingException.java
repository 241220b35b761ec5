package com.insightpulse.kgengine.exception;

public class EmbeddingException extends KnowledgeGraphException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
