package com.slack.distributor.errors;

/**
 * Wraps every error surfaced by the distributor entry points so the query engine can classify it
 * as a storage failure rather than a user error. The cause is the specific failure.
 */
public class StorageException extends RuntimeException {
  public StorageException(Throwable t) {
    super(t.getMessage(), t);
  }

  public static StorageException wrap(Throwable t) {
    if (t instanceof StorageException storageException) {
      return storageException;
    }
    return new StorageException(t);
  }

  /** True when the query was aborted by the caller rather than failing on data. */
  public boolean isCancellation() {
    return getCause() instanceof QueryCancelledException;
  }
}
