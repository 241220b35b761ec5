package com.insightpulse.kgengine.util;

import com.insightpulse.kgengine.model.CallContext;
import com.insightpulse.kgengine.model.ServiceType;
import org.slf4j.Logger;

/**
 * Uniform logging for calls that leave the engine (embedding model, bulk ingestion).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging and storage.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
