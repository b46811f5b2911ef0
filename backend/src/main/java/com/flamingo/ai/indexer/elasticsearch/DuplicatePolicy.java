package com.flamingo.ai.indexer.elasticsearch;

/** What a write does when a passage with the same id is already stored. */
public enum DuplicatePolicy {
  /** Replace the stored document. */
  OVERWRITE,
  /** Keep the stored document and ignore the new one. */
  SKIP,
  /** Reject the batch. */
  FAIL
}
