package com.insightpulse.kgengine.model;

/**
 * Collaborators whose calls are logged through ExternalCallLogger.
 *
 * @see com.insightpulse.kgengine.util.ExternalCallLogger
 */
public enum ServiceType {
    EMBEDDING("🔷", "Embedding"),
    INGESTION("🟢", "Ingestion");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
