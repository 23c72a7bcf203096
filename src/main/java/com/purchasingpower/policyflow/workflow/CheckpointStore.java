package com.purchasingpower.policyflow.workflow;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.policyflow.configuration.AppProperties;
import com.purchasingpower.policyflow.configuration.IdentifierProperties;
import com.purchasingpower.policyflow.model.WorkflowCheckpoint;
import com.purchasingpower.policyflow.persistence.PersistenceGateway;
import com.purchasingpower.policyflow.workflow.state.PolicyWorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes workflow checkpoints in the drafts collection.
 *
 * The first write of a session allocates its quote number; the quote id
 * derived from it is the session id for the rest of the session's life.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckpointStore {

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final PersistenceGateway gateway;
    private final AppProperties props;
    private final ObjectMapper objectMapper;

    public record SessionKey(String sessionId, long quoteNumber) {
    }

    /**
     * Allocate the next quote number and derive the session id from it.
     */
    public SessionKey reserveSession() {
        IdentifierProperties ids = props.getIdentifiers();
        long quoteNumber = gateway.nextSequence(ids.getSequenceField(), draftsCollection(),
                ids.getIncrement(), ids.getDefaultStart());
        SessionKey key = new SessionKey(ids.quoteId(quoteNumber), quoteNumber);
        log.info("🆔 Reserved session {}", key.sessionId());
        return key;
    }

    public WorkflowCheckpoint write(PolicyWorkflowState state) {
        WorkflowCheckpoint checkpoint = state.toCheckpoint();
        if (checkpoint.getId() == null || checkpoint.getQuoteNumber() == null) {
            SessionKey key = reserveSession();
            checkpoint.setId(key.sessionId());
            checkpoint.setQuoteNumber(key.quoteNumber());
        }
        checkpoint.setLastUpdated(Instant.now());

        gateway.upsert(draftsCollection(), objectMapper.convertValue(checkpoint, DOCUMENT_TYPE));
        log.debug("💾 Checkpoint {} written at stage {} ({})", checkpoint.getId(), checkpoint.getStage(),
                checkpoint.getStatus());
        return checkpoint;
    }

    public Optional<WorkflowCheckpoint> load(String sessionId) {
        return gateway.findById(draftsCollection(), sessionId)
                .map(document -> objectMapper.convertValue(document, WorkflowCheckpoint.class));
    }

    private String draftsCollection() {
        return props.getPersistence().getDraftsCollection();
    }
}
