package com.purchasingpower.policyflow.repository;

import com.purchasingpower.policyflow.model.StoredDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for JSON documents grouped by collection.
 *
 * Used by JpaDocumentStore to:
 * - Probe a collection at startup
 * - Load a collection for filtering
 * - Look up and upsert a document by its id
 * - Find the highest sequence value without loading documents
 */
@Repository
public interface StoredDocumentRepository extends JpaRepository<StoredDocument, Long> {

    List<StoredDocument> findByCollectionName(String collectionName);

    Optional<StoredDocument> findByCollectionNameAndDocumentId(String collectionName, String documentId);

    long countByCollectionName(String collectionName);

    @Query("SELECT MAX(d.sequenceValue) FROM StoredDocument d WHERE d.collectionName = :collection")
    Long findMaxSequenceValue(@Param("collection") String collection);
}
