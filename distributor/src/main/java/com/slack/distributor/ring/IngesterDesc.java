package com.slack.distributor.ring;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * IngesterDesc contains what the distributor knows about one replica: the address its client is
 * resolved from, its zone, its state and the ring tokens it owns. Tokens are unsigned 32-bit
 * values.
 */
public class IngesterDesc {
  public final String addr;
  public final String zone;
  public final IngesterState state;
  public final List<Long> tokens;

  public IngesterDesc(String addr, String zone, IngesterState state, List<Long> tokens) {
    checkArgument(addr != null && !addr.isEmpty(), "addr field can't be null or empty");
    checkArgument(state != null, "state can't be null");
    checkArgument(tokens != null, "tokens can't be null");
    for (long token : tokens) {
      checkArgument(token >= 0 && token <= 0xffffffffL, "token %s is out of range", token);
    }
    this.addr = addr;
    this.zone = zone == null ? "" : zone;
    this.state = state;
    this.tokens = ImmutableList.copyOf(tokens);
  }

  /**
   * Writes only go to active ingesters. Reads also go to leaving ingesters, which still hold data
   * until their series have been handed over.
   */
  public boolean isHealthy(Operation op) {
    if (op == Operation.WRITE) {
      return state == IngesterState.ACTIVE;
    }
    return state == IngesterState.ACTIVE || state == IngesterState.LEAVING;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof IngesterDesc that)) return false;
    return addr.equals(that.addr)
        && zone.equals(that.zone)
        && state == that.state
        && tokens.equals(that.tokens);
  }

  @Override
  public int hashCode() {
    return Objects.hash(addr, zone, state, tokens);
  }

  @Override
  public String toString() {
    return "IngesterDesc{"
        + "addr='"
        + addr
        + '\''
        + ", zone='"
        + zone
        + '\''
        + ", state="
        + state
        + '}';
  }
}
