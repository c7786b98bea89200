package com.slack.distributor.client;

/** Resolves the client used to reach an ingester address. */
public interface IngesterClientPool {

  /**
   * @throws RuntimeException if no client can be created for the address
   */
  IngesterClient getClientFor(String address);
}
