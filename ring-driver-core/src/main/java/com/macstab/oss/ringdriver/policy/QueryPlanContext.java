/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

import com.macstab.oss.ringdriver.token.Token;

/**
 * Routing information of one query, handed to {@link HostSelectionPolicy#newQueryPlan}.
 *
 * @param keyspace keyspace the statement targets, null if unknown
 * @param routingToken token of the statement's partition key, null if the statement has no
 *     routing key
 */
public record QueryPlanContext(String keyspace, Token routingToken) {

  /** Context without routing information (control connection, unrouted statements). */
  public static final QueryPlanContext NONE = new QueryPlanContext(null, null);

  public boolean hasRoutingToken() {
    return routingToken != null;
  }
}
