package com.purchasingpower.policyflow.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * JPA entity holding one JSON document of a named collection.
 *
 * Documents are addressed by (collection, document id); the body is the
 * full document serialized as JSON in a CLOB.
 *
 * Table: POLICY_DOCUMENTS
 */
@Entity
@Table(name = "POLICY_DOCUMENTS",
        uniqueConstraints = @UniqueConstraint(name = "uk_policy_doc_collection_id",
                columnNames = {"collection_name", "document_id"}),
        indexes = {
                @Index(name = "idx_policy_doc_collection", columnList = "collection_name"),
                @Index(name = "idx_policy_doc_sequence", columnList = "collection_name, sequence_value")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Collection name, e.g. PolicyDrafts, PolicyIssued.
     */
    @Column(name = "collection_name", nullable = false, length = 100)
    private String collectionName;

    /**
     * The document's own {@code id} field.
     */
    @Column(name = "document_id", nullable = false, length = 100)
    private String documentId;

    /**
     * Numeric part of the document's sequence field (quoteNumber by default), null when absent.
     */
    @Column(name = "sequence_value")
    private Long sequenceValue;

    @Lob
    @Column(name = "body_json", nullable = false)
    private String bodyJson;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
