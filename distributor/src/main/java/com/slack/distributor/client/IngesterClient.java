package com.slack.distributor.client;

import com.slack.distributor.model.QueryRequest;
import com.slack.distributor.model.QueryResponse;

/**
 * Query API of a single ingester. Calls are made with the gRPC context of the replica task
 * current, and implementations are expected to abort with a {@code CANCELLED} status when that
 * context is cancelled.
 */
public interface IngesterClient {

  /** Legacy, sample based query. */
  QueryResponse query(QueryRequest request);

  /** Opens a streaming query. The caller owns the returned stream and must close it. */
  IngesterQueryStream queryStream(QueryRequest request);
}
