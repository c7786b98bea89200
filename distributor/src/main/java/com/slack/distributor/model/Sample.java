package com.slack.distributor.model;

/** A single (timestamp, value) pair. */
public record Sample(long timestampMs, double value) {}
