/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.macstab.oss.ringdriver.host.HostFilter;
import com.macstab.oss.ringdriver.host.HostInfo;

import lombok.Getter;
import lombok.NonNull;

/**
 * Decorator removing hosts rejected by a {@link HostFilter}.
 *
 * <p>Rejected hosts never reach the child: not in {@link #init}, not in notifications, and not in
 * query plans (in case the child learns about them some other way). {@link #distance} ranks them
 * {@link HostDistance#IGNORED}, so a wrapping {@link TokenAwarePolicy} skips them as replicas.
 */
public class FilteringPolicy implements HostSelectionPolicy {

  @Getter private final HostSelectionPolicy childPolicy;
  private final HostFilter filter;

  public FilteringPolicy(
      @NonNull final HostSelectionPolicy childPolicy, @NonNull final HostFilter filter) {
    this.childPolicy = childPolicy;
    this.filter = filter;
  }

  @Override
  public void init(final Collection<HostInfo> hosts) {
    final List<HostInfo> accepted = new ArrayList<>(hosts.size());
    for (final var host : hosts) {
      if (filter.accept(host)) {
        accepted.add(host);
      }
    }
    childPolicy.init(accepted);
  }

  @Override
  public Iterator<HostInfo> newQueryPlan(final QueryPlanContext context) {
    final var plan = childPolicy.newQueryPlan(context);
    return new Iterator<>() {
      HostInfo lookahead;

      @Override
      public boolean hasNext() {
        while (lookahead == null && plan.hasNext()) {
          final var candidate = plan.next();
          if (filter.accept(candidate)) {
            lookahead = candidate;
          }
        }
        return lookahead != null;
      }

      @Override
      public HostInfo next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        final var host = lookahead;
        lookahead = null;
        return host;
      }
    };
  }

  @Override
  public HostDistance distance(final HostInfo host) {
    return filter.accept(host) ? childPolicy.distance(host) : HostDistance.IGNORED;
  }

  @Override
  public void onAdd(final HostInfo host) {
    if (filter.accept(host)) {
      childPolicy.onAdd(host);
    }
  }

  @Override
  public void onUp(final HostInfo host) {
    if (filter.accept(host)) {
      childPolicy.onUp(host);
    }
  }

  @Override
  public void onDown(final HostInfo host) {
    if (filter.accept(host)) {
      childPolicy.onDown(host);
    }
  }

  @Override
  public void onRemove(final HostInfo host) {
    if (filter.accept(host)) {
      childPolicy.onRemove(host);
    }
  }

  @Override
  public void onUpdate(final HostInfo previous, final HostInfo current) {
    final boolean was = filter.accept(previous);
    final boolean is = filter.accept(current);
    if (was && is) {
      childPolicy.onUpdate(previous, current);
    } else if (is) {
      childPolicy.onAdd(current);
    } else if (was) {
      childPolicy.onRemove(previous);
    }
  }

  @Override
  public String getName() {
    return "filtering(" + childPolicy.getName() + ")";
  }
}
