package com.nilsson.soeji.service.search;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 <h2>DocumentIndex</h2>
 <p>
 A searchable store of JSON documents grouped in named collections. Every document carries an
 {@code id} attribute that identifies it within its collection.
 </p>
 <p>
 Failures are reported as {@link IndexException}.
 </p>
 */
public interface DocumentIndex {

    String IMAGES = "images";
    String TAGS = "tags";

    /**
     Declares the attribute sets of a collection, creating the collection when needed.
     */
    void configure(String collection, IndexSettings settings);

    IndexSettings getSettings(String collection);

    /**
     Adds documents, replacing any existing document with the same id as a whole.
     */
    void addDocuments(String collection, List<ObjectNode> documents);

    /**
     Merges the given attributes into existing documents; attributes not present in a partial
     document are kept. A document that does not exist yet is created from the partial one.
     */
    void updateDocuments(String collection, List<ObjectNode> documents);

    /**
     @return false if there was no such document, which is not an error
     */
    boolean deleteDocument(String collection, String id);

    void deleteAllDocuments(String collection);

    Optional<ObjectNode> getDocument(String collection, String id);

    long countDocuments(String collection);

    SearchResult search(String collection, SearchQuery query);
}
