/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.token.ClusterMetadata;

import lombok.Getter;
import lombok.NonNull;

/**
 * Routes a query to the replicas of its partition first.
 *
 * <p><strong>Plan order:</strong>
 *
 * <ol>
 *   <li>Replicas of the routing token, in ring order starting at the primary replica, that are up
 *       and ranked {@link HostDistance#LOCAL} by the child policy
 *   <li>Replicas ranked {@link HostDistance#REMOTE} by the child, in ring order
 *   <li>The child's own plan, minus the replicas already yielded
 * </ol>
 *
 * <p>Replicas the child ignores are skipped. Without a routing token, or when the ring has no
 * replica for it, the plan is the child's plan unchanged.
 *
 * <p>Replica lists come from {@link ClusterMetadata}, whose ring is an immutable snapshot; a plan
 * never mixes two ring versions. Up/down state comes from this policy's own up-host view so a
 * replica that was just marked down is not tried first.
 *
 * <p>With {@code shuffleReplicas} the local replicas are shuffled per query, spreading load over
 * replicas at the cost of primary-replica affinity.
 */
public class TokenAwarePolicy extends AbstractHostSelectionPolicy {

  private final ClusterMetadata metadata;
  @Getter private final HostSelectionPolicy childPolicy;
  private final boolean shuffleReplicas;
  private volatile Map<UUID, HostInfo> liveById = Map.of();

  public TokenAwarePolicy(
      @NonNull final ClusterMetadata metadata, @NonNull final HostSelectionPolicy childPolicy) {
    this(metadata, childPolicy, false);
  }

  public TokenAwarePolicy(
      @NonNull final ClusterMetadata metadata,
      @NonNull final HostSelectionPolicy childPolicy,
      final boolean shuffleReplicas) {
    this.metadata = metadata;
    this.childPolicy = childPolicy;
    this.shuffleReplicas = shuffleReplicas;
  }

  @Override
  public synchronized void init(final Collection<HostInfo> hosts) {
    super.init(hosts);
    childPolicy.init(hosts);
  }

  @Override
  public void onAdd(final HostInfo host) {
    super.onAdd(host);
    childPolicy.onAdd(host);
  }

  @Override
  public void onUp(final HostInfo host) {
    super.onUp(host);
    childPolicy.onUp(host);
  }

  @Override
  public void onDown(final HostInfo host) {
    super.onDown(host);
    childPolicy.onDown(host);
  }

  @Override
  public void onRemove(final HostInfo host) {
    super.onRemove(host);
    childPolicy.onRemove(host);
  }

  @Override
  public void onUpdate(final HostInfo previous, final HostInfo current) {
    super.onUpdate(previous, current);
    childPolicy.onUpdate(previous, current);
  }

  @Override
  public Iterator<HostInfo> newQueryPlan(final QueryPlanContext context) {
    if (!context.hasRoutingToken()) {
      return childPolicy.newQueryPlan(context);
    }
    final var replicas = metadata.replicas(context.keyspace(), context.routingToken());
    if (replicas.isEmpty()) {
      return childPolicy.newQueryPlan(context);
    }
    final var live = liveById;
    final List<HostInfo> local = new ArrayList<>(replicas.size());
    final List<HostInfo> remote = new ArrayList<>();
    for (final var replica : replicas) {
      final var current = live.get(replica.getHostId());
      if (current == null) {
        continue;
      }
      final var distance = childPolicy.distance(current);
      if (distance == HostDistance.LOCAL) {
        local.add(current);
      } else if (distance == HostDistance.REMOTE) {
        remote.add(current);
      }
    }
    if (shuffleReplicas && local.size() > 1) {
      Collections.shuffle(local, ThreadLocalRandom.current());
    }
    local.addAll(remote);
    return new ReplicasFirstIterator(local, childPolicy.newQueryPlan(context));
  }

  @Override
  public HostDistance distance(final HostInfo host) {
    return childPolicy.distance(host);
  }

  @Override
  public String getName() {
    return "token-aware(" + childPolicy.getName() + ")";
  }

  @Override
  protected void onHostsChanged(final List<HostInfo> hosts) {
    final Map<UUID, HostInfo> byId = new HashMap<>(hosts.size() * 2);
    for (final var host : hosts) {
      byId.put(host.getHostId(), host);
    }
    liveById = Collections.unmodifiableMap(byId);
  }

  /** Yields the replicas, then the child plan without them. Lazy over the child plan. */
  private static final class ReplicasFirstIterator implements Iterator<HostInfo> {

    private final List<HostInfo> replicas;
    private final Iterator<HostInfo> child;
    private final Set<UUID> yielded = new HashSet<>();
    private int index;
    private HostInfo lookahead;

    ReplicasFirstIterator(final List<HostInfo> replicas, final Iterator<HostInfo> child) {
      this.replicas = replicas;
      this.child = child;
    }

    @Override
    public boolean hasNext() {
      if (index < replicas.size() || lookahead != null) {
        return true;
      }
      while (child.hasNext()) {
        final var candidate = child.next();
        if (!yielded.contains(candidate.getHostId())) {
          lookahead = candidate;
          return true;
        }
      }
      return false;
    }

    @Override
    public HostInfo next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      final HostInfo host;
      if (index < replicas.size()) {
        host = replicas.get(index++);
      } else {
        host = lookahead;
        lookahead = null;
      }
      yielded.add(host.getHostId());
      return host;
    }
  }
}
