package com.slack.distributor.ring;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.slack.distributor.errors.QuorumFailureException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A token ring built from a fixed list of ingesters. A key is owned by the first {@code
 * replicationFactor} distinct ingesters found walking clockwise from the first token at or after
 * the key. Each owner that is unhealthy for the operation extends the walk by one ingester.
 *
 * <p>A lookup needs a majority of {@code max(replicationFactor, owners walked)} healthy owners, so
 * a ring smaller than the replication factor can't serve reads.
 */
public class StaticRing implements ReadRing {
  private static final Logger LOG = LoggerFactory.getLogger(StaticRing.class);

  private final int replicationFactor;
  private final List<IngesterDesc> ingesters;
  private final List<TokenOwner> tokens;

  private record TokenOwner(long token, IngesterDesc ingester) {}

  public StaticRing(int replicationFactor, List<IngesterDesc> ingesters) {
    checkArgument(replicationFactor >= 1, "replicationFactor must be at least 1");
    this.replicationFactor = replicationFactor;
    this.ingesters = ImmutableList.copyOf(ingesters);

    Set<String> addresses = new HashSet<>();
    List<TokenOwner> tokenOwners = new ArrayList<>();
    for (IngesterDesc ingester : this.ingesters) {
      checkArgument(addresses.add(ingester.addr), "duplicate ingester address %s", ingester.addr);
      for (long token : ingester.tokens) {
        tokenOwners.add(new TokenOwner(token, ingester));
      }
    }
    tokenOwners.sort(Comparator.comparingLong(TokenOwner::token));
    this.tokens = ImmutableList.copyOf(tokenOwners);
  }

  @Override
  public ReplicationSet get(int key, Operation op) {
    if (tokens.isEmpty()) {
      throw new QuorumFailureException("empty ring");
    }

    int wanted = replicationFactor;
    List<IngesterDesc> replicas = new ArrayList<>(wanted);
    Set<String> seen = new HashSet<>();
    int start = firstTokenIndex(Integer.toUnsignedLong(key));
    for (int i = 0; i < tokens.size() && replicas.size() < wanted; i++) {
      IngesterDesc owner = tokens.get((start + i) % tokens.size()).ingester();
      if (!seen.add(owner.addr)) {
        continue;
      }
      replicas.add(owner);
      // the next owner along the ring took the writes an unhealthy owner couldn't
      if (!owner.isHealthy(op)) {
        wanted++;
      }
    }

    int minSuccess = (Math.max(replicationFactor, replicas.size()) / 2) + 1;
    List<IngesterDesc> healthy =
        replicas.stream().filter(ingester -> ingester.isHealthy(op)).collect(Collectors.toList());
    if (healthy.size() < minSuccess) {
      throw new QuorumFailureException(
          String.format(
              "at least %d live replicas required, could only find %d",
              minSuccess, healthy.size()));
    }
    LOG.debug(
        "Ring lookup key={} op={} replicas={} healthy={}",
        Integer.toUnsignedString(key),
        op,
        replicas.size(),
        healthy.size());
    return new ReplicationSet(healthy, healthy.size() - minSuccess);
  }

  /**
   * Every ingester can hold any series when sharding by all labels, so the query can only tolerate
   * as many failures as a single replica set would.
   */
  @Override
  public ReplicationSet getAll() {
    int maxErrors = replicationFactor / 2;
    List<IngesterDesc> healthy = new ArrayList<>(ingesters.size());
    for (IngesterDesc ingester : ingesters) {
      if (ingester.isHealthy(Operation.READ)) {
        healthy.add(ingester);
      } else {
        maxErrors--;
      }
    }
    if (maxErrors < 0) {
      throw new QuorumFailureException("too many failed ingesters");
    }
    return new ReplicationSet(healthy, maxErrors);
  }

  private int firstTokenIndex(long key) {
    int low = 0;
    int high = tokens.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (tokens.get(mid).token() < key) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low == tokens.size() ? 0 : low;
  }
}
