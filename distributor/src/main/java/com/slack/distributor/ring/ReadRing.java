package com.slack.distributor.ring;

/** Replica membership as seen by the read path. */
public interface ReadRing {

  /**
   * Returns the replicas owning the given ring key.
   *
   * @throws com.slack.distributor.errors.QuorumFailureException if the ring can't supply enough
   *     healthy replicas for the key
   */
  ReplicationSet get(int key, Operation op);

  /** Returns every healthy ingester, used when a query can't be narrowed to one shard. */
  ReplicationSet getAll();
}
