/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.spring3;

import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/** Matches when {@code ringdriver.contact-points} holds at least one entry. */
class OnContactPointsCondition extends SpringBootCondition {

  static final String PROPERTY = "ringdriver.contact-points";

  @Override
  public ConditionOutcome getMatchOutcome(
      final ConditionContext context, final AnnotatedTypeMetadata metadata) {
    final List<String> contactPoints =
        Binder.get(context.getEnvironment())
            .bind(PROPERTY, Bindable.listOf(String.class))
            .orElse(List.of());
    if (contactPoints.stream().anyMatch(point -> !point.isBlank())) {
      return ConditionOutcome.match(PROPERTY + " is set");
    }
    return ConditionOutcome.noMatch(PROPERTY + " is not set");
  }
}
