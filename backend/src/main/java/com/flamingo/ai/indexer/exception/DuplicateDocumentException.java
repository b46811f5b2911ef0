package com.flamingo.ai.indexer.exception;

import java.util.List;

/** Thrown under the {@code fail} duplicate policy when passages already exist. */
public class DuplicateDocumentException extends DocumentStoreException {

  private final List<String> duplicateIds;

  public DuplicateDocumentException(String collection, List<String> duplicateIds) {
    super(
        collection,
        "Document(s) with id(s) " + duplicateIds + " already exist in index '" + collection + "'");
    this.duplicateIds = List.copyOf(duplicateIds);
  }

  public List<String> getDuplicateIds() {
    return duplicateIds;
  }
}
