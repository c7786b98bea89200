package com.slack.distributor.client;

import com.slack.distributor.model.QueryStreamResponse;
import java.io.Closeable;
import org.checkerframework.checker.nullness.qual.Nullable;

/** The receiving side of a streaming query against one ingester. */
public interface IngesterQueryStream extends Closeable {

  /**
   * Blocks until the ingester sends the next partial response.
   *
   * @return the next partial response, or null once the ingester has finished the stream
   */
  @Nullable
  QueryStreamResponse recv();

  /** Releases the call. Safe to invoke more than once and after an error. */
  @Override
  void close();
}
