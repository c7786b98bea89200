package com.slack.distributor.ring;

/** Lifecycle state of an ingester in the ring. */
public enum IngesterState {
  PENDING,
  JOINING,
  ACTIVE,
  LEAVING,
  LEFT
}
