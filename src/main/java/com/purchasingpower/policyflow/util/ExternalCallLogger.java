package com.purchasingpower.policyflow.util;

import com.purchasingpower.policyflow.model.CallContext;
import com.purchasingpower.policyflow.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging for external calls (generation services, document store).
 * Provides consistent, structured request/response logging.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, String sessionId, Logger logger) {
        return new CallContext(service, operation, sessionId, logger);
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
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
