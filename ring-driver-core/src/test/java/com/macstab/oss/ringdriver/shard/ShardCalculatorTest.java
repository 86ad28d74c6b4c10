/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.shard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.concurrent.ThreadLocalRandom;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.macstab.oss.ringdriver.token.Murmur3Token;
import com.macstab.oss.ringdriver.token.RandomToken;

/**
 * Tests for {@link ShardCalculator}.
 *
 * <p>Expected shards follow the server's biased-token algorithm, including the ignored most
 * significant bits.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("ShardCalculator")
class ShardCalculatorTest {

  @Nested
  @DisplayName("Two Shards")
  class TwoShards {

    private final ShardCalculator calculator = new ShardCalculator(2, 0);

    @Test
    @DisplayName("lower half of the token range maps to shard 0")
    void shardOf_LowerHalf_Shard0() {
      // Act & Assert
      assertThat(calculator.shardOf(Long.MIN_VALUE)).isZero();
      assertThat(calculator.shardOf(-1L)).isZero();
    }

    @Test
    @DisplayName("upper half of the token range maps to shard 1")
    void shardOf_UpperHalf_Shard1() {
      // Act & Assert
      assertThat(calculator.shardOf(0L)).isEqualTo(1);
      assertThat(calculator.shardOf(Long.MAX_VALUE)).isEqualTo(1);
    }
  }

  @ParameterizedTest(name = "token {0}, {1} shards, ignoreMsb {2} -> shard {3}")
  @CsvSource({
    "0, 3, 0, 1",
    "0, 3, 12, 0",
    "-1, 7, 0, 3",
    "-4069959284402364209, 8, 12, 2",
    "-3758069500696749310, 8, 12, 4",
    "1234567890123, 16, 12, 0"
  })
  @DisplayName("matches the server's shard assignment")
  void shardOf_MatchesServer(
      final long token, final int shards, final int ignoreMsb, final int expected) {
    // Arrange
    final var calculator = new ShardCalculator(shards, ignoreMsb);

    // Act & Assert
    assertThat(calculator.shardOf(token)).isEqualTo(expected);
    assertThat(calculator.shardOf(new Murmur3Token(token))).isEqualTo(expected);
  }

  @Test
  @DisplayName("result is always within [0, shardCount)")
  void shardOf_AlwaysInRange() {
    // Arrange
    final var calculator = new ShardCalculator(13, 12);
    final var random = ThreadLocalRandom.current();

    // Act & Assert
    for (int i = 0; i < 10_000; i++) {
      assertThat(calculator.shardOf(random.nextLong())).isBetween(0, 12);
    }
  }

  @Test
  @DisplayName("tokens of other partitioners land on shard 0")
  void shardOf_NonMurmur3Token_Shard0() {
    // Arrange
    final var calculator = new ShardCalculator(4, 12);

    // Act & Assert
    assertThat(calculator.shardOf(new RandomToken(BigInteger.TEN))).isZero();
  }

  @Test
  @DisplayName("rejects non-positive shard counts")
  void constructor_InvalidShardCount_Throws() {
    // Act & Assert
    assertThatThrownBy(() -> new ShardCalculator(0, 12))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ShardCalculator(2, 64))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
