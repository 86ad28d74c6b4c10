/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

import java.util.Collection;
import java.util.Iterator;

import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.host.HostListener;

/**
 * Produces the ordered candidate hosts for a query.
 *
 * <p><strong>Built-in variants:</strong>
 *
 * <ul>
 *   <li>{@link RoundRobinPolicy} - every up host, rotated per query
 *   <li>{@link DcAwareRoundRobinPolicy} - local datacenter first, remote hosts as rotated overflow
 *   <li>{@link TokenAwarePolicy} - replicas of the routing token first, then a child policy
 *   <li>{@link FilteringPolicy} - drops hosts rejected by a {@code HostFilter}
 * </ul>
 *
 * <p><strong>State:</strong> a policy keeps a derived view of the up hosts and updates it from
 * the {@link HostListener} callbacks it receives from the registry. It never mutates a {@link
 * HostInfo} and never becomes the source of truth for host status: callbacks run synchronously
 * with registry mutations, so the view is at most one notification behind.
 *
 * <p><strong>Thread safety:</strong> {@link #newQueryPlan} is called concurrently by every
 * in-flight query while notifications arrive on the control connection's event thread.
 * Implementations must be safe for that.
 *
 * <p>Custom implementations plug in through {@code SessionConfig.hostSelectionPolicy}.
 */
public interface HostSelectionPolicy extends HostListener {

  /**
   * Seeds the policy with the hosts known when the session starts. Called once, before the
   * policy is subscribed to the registry.
   *
   * @param hosts every known host; implementations keep the up ones
   */
  void init(Collection<HostInfo> hosts);

  /**
   * Candidates for one query, best first. The iterator is consumed lazily by one query and never
   * shared; it must not repeat a host.
   *
   * @param context routing information
   * @return candidate hosts
   */
  Iterator<HostInfo> newQueryPlan(QueryPlanContext context);

  /** Rank of {@code host} under this policy. */
  HostDistance distance(HostInfo host);

  /** Name used in logs and metric tags. */
  default String getName() {
    return getClass().getSimpleName();
  }
}
