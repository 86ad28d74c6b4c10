/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.speculative;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for the speculative execution policies.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("SpeculativeExecutionPolicy")
class SpeculativeExecutionPolicyTest {

  @Test
  @DisplayName("constant policy allows the configured number of extra executions")
  void constant_LimitsExtraExecutions() {
    // Arrange
    final var policy = new ConstantSpeculativeExecutionPolicy(Duration.ofMillis(50), 2);

    // Act & Assert
    assertThat(policy.nextExecution(1)).contains(Duration.ofMillis(50));
    assertThat(policy.nextExecution(2)).contains(Duration.ofMillis(50));
    assertThat(policy.nextExecution(3)).isEmpty();
  }

  @Test
  @DisplayName("no-op policy never speculates")
  void none_NeverSpeculates() {
    // Act & Assert
    assertThat(NoSpeculativeExecutionPolicy.INSTANCE.nextExecution(1)).isEmpty();
  }

  @Test
  @DisplayName("rejects invalid settings")
  void constant_InvalidSettings_Throw() {
    // Act & Assert
    assertThatThrownBy(() -> new ConstantSpeculativeExecutionPolicy(Duration.ofMillis(-1), 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ConstantSpeculativeExecutionPolicy(Duration.ofMillis(1), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
