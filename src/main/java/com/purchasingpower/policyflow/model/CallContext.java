package com.purchasingpower.policyflow.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracks one external call: a short call id, the session it belongs to and
 * timing for the response/error line.
 *
 * @see com.purchasingpower.policyflow.util.ExternalCallLogger
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final String sessionId;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, String sessionId, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.sessionId = sessionId != null ? sessionId : "-";
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary, Object... details) {
        logger.info("{} {} → {} [{}] session={}",
                service.getEmoji(), service.getName(), operation, callId, sessionId);
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Request: {}", summary);
        }
        logDetails(details);
    }

    public void logResponse(String summary, Object... details) {
        logger.info("{} {} ← {} [{}] session={} ({}ms)",
                service.getEmoji(), service.getName(), operation, callId, sessionId, getElapsedMs());
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Response: {}", summary);
        }
        logDetails(details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] session={} ({}ms) - {}",
                service.getEmoji(), service.getName(), operation, callId, sessionId, getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    private void logDetails(Object... details) {
        if (details == null) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.debug("  {}: {}", details[i], details[i + 1]);
        }
    }

    public String getCallId() {
        return callId;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
