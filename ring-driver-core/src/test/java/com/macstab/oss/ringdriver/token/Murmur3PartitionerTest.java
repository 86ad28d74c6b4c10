/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Murmur3Partitioner}.
 *
 * <p>Expected tokens are the ones the server assigns to the same partition keys, so routing
 * computed here lands on the replicas the server would pick.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("Murmur3Partitioner")
class Murmur3PartitionerTest {

  private final Murmur3Partitioner partitioner = new Murmur3Partitioner();

  @Nested
  @DisplayName("Hashing")
  class Hashing {

    @Test
    @DisplayName("hashes a text key to the server token")
    void hash_TextKey_MatchesServerToken() {
      // Act
      final var token = partitioner.hash(utf8("hello"));

      // Assert
      assertThat(token).isEqualTo(new Murmur3Token(-3758069500696749310L));
    }

    @Test
    @DisplayName("hashes a serialized int key to the server token")
    void hash_IntKey_MatchesServerToken() {
      // Act
      final var token = partitioner.hash(ByteBuffer.allocate(4).putInt(0, 1));

      // Assert
      assertThat(token).isEqualTo(new Murmur3Token(-4069959284402364209L));
    }

    @Test
    @DisplayName("hashes keys longer than one 16-byte block")
    void hash_MultiBlockKey_MatchesServerToken() {
      // Act
      final var token = partitioner.hash(utf8("The quick brown fox jumps over the lazy dog"));

      // Assert
      assertThat(token).isEqualTo(new Murmur3Token(-2068352364225029268L));
    }

    @Test
    @DisplayName("sign-extends tail bytes >= 0x80 like the server does")
    void hash_HighTailBytes_SignExtended() {
      // Act
      final var token = partitioner.hash(ByteBuffer.wrap(new byte[] {(byte) 0xff, (byte) 0x80}));

      // Assert
      assertThat(token).isEqualTo(new Murmur3Token(8915363533249992128L));
    }

    @Test
    @DisplayName("empty key hashes to zero")
    void hash_EmptyKey_IsZero() {
      // Act & Assert
      assertThat(partitioner.hash(ByteBuffer.allocate(0))).isEqualTo(new Murmur3Token(0L));
    }

    @Test
    @DisplayName("hashes only the bytes between position and limit without consuming them")
    void hash_RespectsBufferPosition() {
      // Arrange
      final var padded = ByteBuffer.wrap("xxhello".getBytes(StandardCharsets.UTF_8));
      padded.position(2);

      // Act
      final var token = partitioner.hash(padded);

      // Assert
      assertThat(token).isEqualTo(partitioner.hash(utf8("hello")));
      assertThat(padded.position()).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("Parsing")
  class Parsing {

    @Test
    @DisplayName("parses signed decimal tokens")
    void parse_SignedDecimal() {
      // Act & Assert
      assertThat(partitioner.parse("-9223372036854775808"))
          .isEqualTo(new Murmur3Token(Long.MIN_VALUE));
      assertThat(partitioner.parse(" 42 ")).isEqualTo(new Murmur3Token(42L));
    }

    @Test
    @DisplayName("rejects non-numeric tokens")
    void parse_Garbage_Throws() {
      // Act & Assert
      assertThatThrownBy(() -> partitioner.parse("abc"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("abc");
    }

    @Test
    @DisplayName("tokens order by signed value")
    void tokens_OrderBySignedValue() {
      // Act & Assert
      assertThat(partitioner.parse("-5")).isLessThan(partitioner.parse("3"));
    }
  }

  @Test
  @DisplayName("resolves by the class name the cluster reports")
  void partitioners_ForName_ResolvesMurmur3() {
    // Act & Assert
    assertThat(Partitioners.forName(Murmur3Partitioner.NAME)).containsSame(Partitioners.MURMUR3);
    assertThat(Partitioners.forName("org.example.Unknown")).isEmpty();
  }

  private static ByteBuffer utf8(final String value) {
    return ByteBuffer.wrap(value.getBytes(StandardCharsets.UTF_8));
  }
}
