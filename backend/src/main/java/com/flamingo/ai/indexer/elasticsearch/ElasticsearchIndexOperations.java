package com.flamingo.ai.indexer.elasticsearch;

import java.util.List;

/**
 * Write-side operations on the collections documents are indexed into.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T> {

  /**
   * Creates the index with the expected mappings, or checks an existing one is compatible and adds
   * any missing fields.
   *
   * @param index the collection name
   */
  void ensureIndex(String index);

  /**
   * Writes documents in one bulk request, resolving id collisions with the configured {@link
   * DuplicatePolicy}.
   *
   * @param index the collection name
   * @param documents the documents to write
   */
  void writeDocuments(String index, List<T> documents);

  /**
   * Counts the documents of an index.
   *
   * @param index the collection name
   * @return the document count
   */
  long count(String index);

  /**
   * Checks that the cluster answers.
   *
   * @return {@code true} if the ping succeeded
   */
  boolean ping();
}
