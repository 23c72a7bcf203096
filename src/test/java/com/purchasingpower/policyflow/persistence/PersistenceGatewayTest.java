package com.purchasingpower.policyflow.persistence;

import com.purchasingpower.policyflow.configuration.AppProperties;
import com.purchasingpower.policyflow.exception.StoreQueryException;
import com.purchasingpower.policyflow.exception.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Persistence Gateway Tests")
class PersistenceGatewayTest {

    private static final String DRAFTS = "PolicyDrafts";
    private static final String ISSUED = "PolicyIssued";
    private static final String QUESTIONS = "UnderwritingQuestions";

    private FlakyStore durable;
    private InMemoryDocumentStore mirror;
    private PersistenceGateway gateway;

    /**
     * Durable store stand-in whose collections can be taken offline or made to fail queries.
     */
    static class FlakyStore extends InMemoryDocumentStore {
        final Set<String> offline = new HashSet<>();
        final Set<String> brokenQueries = new HashSet<>();
        final Set<String> brokenWrites = new HashSet<>();
        int findAllCalls;

        @Override
        public String getName() {
            return "flaky";
        }

        @Override
        public void probe(String collection) {
            check(collection);
            super.probe(collection);
        }

        @Override
        public List<Map<String, Object>> findAll(String collection) {
            check(collection);
            findAllCalls++;
            if (brokenQueries.contains(collection)) {
                throw new StoreQueryException(collection, "bad filter", null);
            }
            return super.findAll(collection);
        }

        @Override
        public Optional<Map<String, Object>> findById(String collection, String id) {
            check(collection);
            if (brokenQueries.contains(collection)) {
                throw new StoreQueryException(collection, "bad filter", null);
            }
            return super.findById(collection, id);
        }

        @Override
        public void upsert(String collection, String id, Map<String, Object> document) {
            check(collection);
            if (brokenWrites.contains(collection)) {
                throw new StoreQueryException(collection, "value too large for column", null);
            }
            super.upsert(collection, id, document);
        }

        private void check(String collection) {
            if (offline.contains(collection)) {
                throw new StoreUnavailableException(collection, "connection refused", null);
            }
        }
    }

    @BeforeEach
    void setUp() {
        durable = new FlakyStore();
        mirror = new InMemoryDocumentStore();
        AppProperties props = new AppProperties();
        ReferenceDatasets referenceDatasets = new ReferenceDatasets();
        referenceDatasets.loadDatasets();
        gateway = new PersistenceGateway(durable, mirror, new SequenceAllocator(null, null, props),
                referenceDatasets, props);
    }

    @Test
    @DisplayName("Should fall back per collection when a startup check fails")
    void initialize_PartialOutage_ShouldMirrorOnlyFailedCollections() {
        // Given
        durable.offline.add(DRAFTS);

        // When
        gateway.initialize();

        // Then
        assertThat(gateway.isDurable(DRAFTS)).isFalse();
        assertThat(gateway.isDurable(ISSUED)).isTrue();
    }

    @Test
    @DisplayName("Should serve a mirrored collection transparently")
    void upsertAndQuery_MirroredCollection_ShouldRoundTrip() {
        // Given
        durable.offline.add(DRAFTS);
        gateway.initialize();

        // When
        gateway.upsert(DRAFTS, Map.of("id", "QUOTE100000", "quoteNumber", 100000));
        QueryResult result = gateway.query(DRAFTS, Map.of("id", "QUOTE100000"));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSource()).isEqualTo("memory");
        assertThat(result.getData()).hasSize(1);
        assertThat(durable.size(DRAFTS)).isZero();
    }

    @Test
    @DisplayName("Should switch to the mirror when the store goes down mid-run")
    void query_StoreLostAfterWrite_ShouldAnswerFromMirror() {
        // Given
        gateway.initialize();
        gateway.upsert(ISSUED, Map.of("id", "MV100000", "status", "Active"));
        assertThat(durable.size(ISSUED)).isEqualTo(1);

        // When
        durable.offline.add(ISSUED);
        QueryResult result = gateway.query(ISSUED, Map.of("status", "Active"));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSource()).isEqualTo("memory");
        assertThat(result.getData()).extracting(doc -> doc.get("id")).containsExactly("MV100000");
        assertThat(gateway.isDurable(ISSUED)).isFalse();
    }

    @Test
    @DisplayName("Should return an error envelope instead of throwing on query errors")
    void query_QueryError_ShouldReturnErrorEnvelope() {
        // Given
        gateway.initialize();
        durable.brokenQueries.add(ISSUED);

        // When
        QueryResult result = gateway.query(ISSUED, Map.of());

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getStatus()).isEqualTo(QueryResult.Status.ERROR);
        assertThat(result.getMessage()).contains("bad filter");
    }

    @Test
    @DisplayName("Should substitute the built-in underwriting questions")
    void query_EmptyReferenceCollection_ShouldReturnDefaults() {
        // Given
        gateway.initialize();

        // When
        QueryResult all = gateway.query(QUESTIONS, Map.of());
        QueryResult mandatory = gateway.query(QUESTIONS, Map.of("mandatory", true));

        // Then
        assertThat(all.getStatus()).isEqualTo(QueryResult.Status.DEFAULTED);
        assertThat(all.getData()).hasSize(4);
        assertThat(mandatory.getData()).extracting(doc -> doc.get("id"))
                .containsExactlyInAnyOrder("UW-LICENSE", "UW-REGISTRATION", "UW-MVR-CONSENT");
    }

    @Test
    @DisplayName("Should substitute reference defaults on query errors too")
    void query_BrokenReferenceCollection_ShouldReturnDefaults() {
        // Given
        gateway.initialize();
        durable.brokenQueries.add(QUESTIONS);

        // When
        QueryResult result = gateway.query(QUESTIONS, Map.of());

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSource()).isEqualTo("defaults");
        assertThat(result.getData()).isNotEmpty();
    }

    @Test
    @DisplayName("Should prefer stored questions over the built-in set")
    void query_StoredReferenceData_ShouldNotBeReplaced() {
        // Given
        gateway.initialize();
        gateway.upsert(QUESTIONS, Map.of("id", "UW-CUSTOM", "text", "Custom?", "mandatory", true));

        // When
        QueryResult result = gateway.query(QUESTIONS, Map.of());

        // Then
        assertThat(result.getStatus()).isEqualTo(QueryResult.Status.OK);
        assertThat(result.getData()).extracting(doc -> doc.get("id")).containsExactly("UW-CUSTOM");
    }

    @Test
    @DisplayName("Should allocate sequence numbers against the mirror when offline")
    void nextSequence_OfflineCollection_ShouldUseMirror() {
        // Given
        durable.offline.add(DRAFTS);
        gateway.initialize();

        // When
        long first = gateway.nextSequence("quoteNumber", DRAFTS, 10, 100000);
        gateway.upsert(DRAFTS, Map.of("id", "QUOTE" + first, "quoteNumber", first));
        long second = gateway.nextSequence("quoteNumber", DRAFTS, 10, 100000);

        // Then
        assertThat(first).isEqualTo(100000);
        assertThat(second).isEqualTo(100010);
    }

    @Test
    @DisplayName("Should read back a document whose durable write was rejected")
    void findById_RejectedDurableWrite_ShouldReturnNewestVersion() {
        // Given
        gateway.initialize();
        gateway.upsert(DRAFTS, Map.of("id", "QUOTE100000", "stage", "intake"));
        durable.brokenWrites.add(DRAFTS);

        // When
        gateway.upsert(DRAFTS, Map.of("id", "QUOTE100000", "stage", "risk"));
        gateway.upsert(DRAFTS, Map.of("id", "QUOTE100010", "stage", "intake"));

        // Then
        assertThat(gateway.isDurable(DRAFTS)).isTrue();
        assertThat(durable.findById(DRAFTS, "QUOTE100000")).get()
                .extracting(doc -> doc.get("stage")).isEqualTo("intake");
        assertThat(gateway.findById(DRAFTS, "QUOTE100000")).get()
                .extracting(doc -> doc.get("stage")).isEqualTo("risk");
        assertThat(gateway.findById(DRAFTS, "QUOTE100010")).isPresent();
    }

    @Test
    @DisplayName("Should overlay rejected writes on durable query results")
    void query_RejectedDurableWrite_ShouldMergeMirrorCopies() {
        // Given
        gateway.initialize();
        gateway.upsert(DRAFTS, Map.of("id", "QUOTE100000", "stage", "intake"));
        durable.brokenWrites.add(DRAFTS);
        gateway.upsert(DRAFTS, Map.of("id", "QUOTE100000", "stage", "risk"));
        gateway.upsert(DRAFTS, Map.of("id", "QUOTE100010", "stage", "intake"));

        // When
        QueryResult all = gateway.query(DRAFTS, Map.of());
        QueryResult atRisk = gateway.query(DRAFTS, Map.of("stage", "risk"));

        // Then
        assertThat(all.getData()).extracting(doc -> doc.get("id"))
                .containsExactlyInAnyOrder("QUOTE100000", "QUOTE100010");
        assertThat(atRisk.getData()).extracting(doc -> doc.get("id")).containsExactly("QUOTE100000");
    }

    @Test
    @DisplayName("Should return to the durable copy once a later write succeeds")
    void findById_DurableWriteRecovered_ShouldReadDurable() {
        // Given
        gateway.initialize();
        durable.brokenWrites.add(DRAFTS);
        gateway.upsert(DRAFTS, Map.of("id", "QUOTE100000", "stage", "intake"));
        durable.brokenWrites.clear();

        // When
        gateway.upsert(DRAFTS, Map.of("id", "QUOTE100000", "stage", "profile"));
        mirror.upsert(DRAFTS, "QUOTE100000", Map.of("id", "QUOTE100000", "stage", "mirror-only"));

        // Then
        assertThat(gateway.findById(DRAFTS, "QUOTE100000")).get()
                .extracting(doc -> doc.get("stage")).isEqualTo("profile");
    }

    @Test
    @DisplayName("Should answer id lookups without scanning the collection")
    void query_IdOnlyFilter_ShouldNotScan() {
        // Given
        gateway.initialize();
        gateway.upsert(ISSUED, Map.of("id", "MV100000", "status", "Active"));

        // When
        QueryResult result = gateway.query(ISSUED, Map.of("id", "MV100000"));

        // Then
        assertThat(result.getData()).hasSize(1);
        assertThat(result.getSource()).isEqualTo("flaky");
        assertThat(durable.findAllCalls).isZero();
    }

    @Test
    @DisplayName("Should not substitute defaults when a populated reference collection has no match")
    void query_PopulatedReferenceCollectionNoMatch_ShouldReturnEmpty() {
        // Given
        gateway.initialize();
        gateway.upsert(QUESTIONS, Map.of("id", "UW-CUSTOM", "text", "Custom?", "mandatory", true));

        // When
        QueryResult result = gateway.query(QUESTIONS, Map.of("id", "UW-LICENSE"));

        // Then
        assertThat(result.getStatus()).isEqualTo(QueryResult.Status.OK);
        assertThat(result.getData()).isEmpty();
    }

    @Test
    @DisplayName("Should reject documents without an id")
    void upsert_MissingId_ShouldThrow() {
        gateway.initialize();

        assertThatThrownBy(() -> gateway.upsert(DRAFTS, Map.of("status", "Draft")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(DRAFTS);
    }
}
