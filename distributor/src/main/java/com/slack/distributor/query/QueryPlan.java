package com.slack.distributor.query;

import com.slack.distributor.model.QueryRequest;
import com.slack.distributor.ring.ReplicationSet;

/** The replicas to ask and the request to send them. */
public record QueryPlan(ReplicationSet replicationSet, QueryRequest request) {}
