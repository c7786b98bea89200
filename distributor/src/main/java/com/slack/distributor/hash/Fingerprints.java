package com.slack.distributor.hash;

import com.slack.distributor.model.Fingerprint;
import com.slack.distributor.model.Label;
import com.slack.distributor.model.Labels;

/**
 * Label set fingerprints. {@link #fingerprint} hashes the labels in name order and is used to
 * merge legacy responses. {@link #fastFingerprint} XORs per-label hashes, so it does not depend on
 * label order, and is used to merge streaming responses. The two produce different values for the
 * same labels and must not be mixed.
 */
public final class Fingerprints {
  private static final byte SEPARATOR = (byte) 0xff;

  private Fingerprints() {}

  public static Fingerprint fingerprint(Labels labels) {
    long sum = Fnv.OFFSET_64;
    for (Label label : labels) {
      sum = Fnv.add64(sum, label.name());
      sum = Fnv.addByte64(sum, SEPARATOR);
      sum = Fnv.add64(sum, label.value());
      sum = Fnv.addByte64(sum, SEPARATOR);
    }
    return new Fingerprint(sum);
  }

  public static Fingerprint fastFingerprint(Labels labels) {
    if (labels.isEmpty()) {
      return new Fingerprint(Fnv.OFFSET_64);
    }
    long result = 0;
    for (Label label : labels) {
      long sum = Fnv.add64(Fnv.OFFSET_64, label.name());
      sum = Fnv.addByte64(sum, SEPARATOR);
      sum = Fnv.add64(sum, label.value());
      result ^= sum;
    }
    return new Fingerprint(result);
  }
}
