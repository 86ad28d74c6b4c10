/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.ringdriver.error.ErrorCode;
import com.macstab.oss.ringdriver.error.FrameProtocolException;
import com.macstab.oss.ringdriver.error.ReadFailureException;
import com.macstab.oss.ringdriver.query.Consistency;
import com.macstab.oss.ringdriver.shard.ShardingInfo;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;

/**
 * Tests for frame encoding and decoding.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>Requests are encoded into a heap buffer and checked byte by byte
 *   <li>Responses are hand-assembled with {@link CodecUtils} writers and decoded
 *   <li>Stream splitting runs through an {@link EmbeddedChannel}
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("Frame codec")
class FrameCodecTest {

  private static final int RESPONSE_V4 = 0x84;
  private static final int RESPONSE_V5 = 0x85;

  private final ByteBuf buffer = Unpooled.buffer();

  @AfterEach
  void release() {
    buffer.release();
  }

  private static ByteBuf response(
      final int versionByte, final int flags, final Opcode opcode, final Consumer<ByteBuf> body) {
    final var bodyBuf = Unpooled.buffer();
    body.accept(bodyBuf);
    final var frame = Unpooled.buffer();
    frame.writeByte(versionByte);
    frame.writeByte(flags);
    frame.writeShort(7);
    frame.writeByte(opcode.code());
    frame.writeInt(bodyBuf.readableBytes());
    frame.writeBytes(bodyBuf);
    bodyBuf.release();
    return frame;
  }

  private static Message decode(final ByteBuf frame) {
    try {
      return FrameDecoder.decodeFrame(frame).message();
    } finally {
      frame.release();
    }
  }

  private static ByteBuffer utf8(final String value) {
    return ByteBuffer.wrap(value.getBytes(StandardCharsets.UTF_8));
  }

  private static void writeInetAddr(final ByteBuf out, final InetAddress address) {
    final var bytes = address.getAddress();
    out.writeByte(bytes.length);
    out.writeBytes(bytes);
  }

  @Nested
  @DisplayName("Request encoding")
  class Encoding {

    @Test
    @DisplayName("OPTIONS is a bare header with an empty body")
    void encode_Options_HeaderOnly() {
      // Act
      FrameEncoder.encodeFrame(
          Frame.request(ProtocolVersion.V4, 3, OptionsRequest.INSTANCE), buffer);

      // Assert
      assertThat(buffer.readableBytes()).isEqualTo(Frame.HEADER_LENGTH);
      assertThat(buffer.readByte()).isEqualTo((byte) 4);
      assertThat(buffer.readByte()).isZero();
      assertThat(buffer.readShort()).isEqualTo((short) 3);
      assertThat(buffer.readByte()).isEqualTo((byte) Opcode.OPTIONS.code());
      assertThat(buffer.readInt()).isZero();
    }

    @Test
    @DisplayName("QUERY on v4 writes the flags as a single byte")
    void encode_QueryV4_ByteFlags() {
      // Arrange
      final var parameters =
          new QueryParameters(Consistency.QUORUM, null, 100, null, null, Long.MIN_VALUE);

      // Act
      FrameEncoder.encodeFrame(
          Frame.request(ProtocolVersion.V4, 1, new QueryRequest("SELECT 1", parameters)), buffer);

      // Assert
      buffer.skipBytes(5);
      final int length = buffer.readInt();
      assertThat(length).isEqualTo(buffer.readableBytes());
      assertThat(CodecUtils.readLongString(buffer)).isEqualTo("SELECT 1");
      assertThat(buffer.readUnsignedShort()).isEqualTo(Consistency.QUORUM.code());
      assertThat(buffer.readByte()).isEqualTo((byte) QueryParameters.FLAG_PAGE_SIZE);
      assertThat(buffer.readInt()).isEqualTo(100);
      assertThat(buffer.isReadable()).isFalse();
    }

    @Test
    @DisplayName("QUERY on v5 writes the flags as an int")
    void encode_QueryV5_IntFlags() {
      // Arrange
      final var state = ByteBuffer.wrap(new byte[] {1, 2});
      final var parameters =
          new QueryParameters(Consistency.ONE, null, 0, state, null, Long.MIN_VALUE);

      // Act
      FrameEncoder.encodeFrame(
          Frame.request(ProtocolVersion.V5, 1, new QueryRequest("q", parameters)), buffer);

      // Assert
      buffer.skipBytes(Frame.HEADER_LENGTH);
      CodecUtils.readLongString(buffer);
      buffer.readUnsignedShort();
      assertThat(buffer.readInt()).isEqualTo(QueryParameters.FLAG_PAGING_STATE);
      assertThat(buffer.readInt()).isEqualTo(2);
      assertThat(buffer.readByte()).isEqualTo((byte) 1);
      assertThat(buffer.readByte()).isEqualTo((byte) 2);
    }

    @Test
    @DisplayName("a custom payload is flagged and written ahead of the body")
    void encode_CustomPayload_FlaggedBeforeBody() {
      // Arrange
      final var parameters =
          new QueryParameters(Consistency.ONE, null, 0, null, null, Long.MIN_VALUE);
      final var request =
          new QueryRequest("q", parameters, Map.of("trace-tag", utf8("orders")));

      // Act
      FrameEncoder.encodeFrame(Frame.request(ProtocolVersion.V4, 2, request), buffer);

      // Assert
      buffer.skipBytes(1);
      assertThat(buffer.readByte()).isEqualTo((byte) Frame.FLAG_CUSTOM_PAYLOAD);
      buffer.skipBytes(3);
      assertThat(buffer.readInt()).isEqualTo(buffer.readableBytes());
      assertThat(CodecUtils.readBytesMap(buffer))
          .containsExactly(Map.entry("trace-tag", utf8("orders")));
      assertThat(CodecUtils.readLongString(buffer)).isEqualTo("q");
    }

    @Test
    @DisplayName("a custom payload cannot be sent on v3")
    void request_CustomPayloadV3_Rejected() {
      // Arrange
      final var request =
          new QueryRequest(
              "q", QueryParameters.of(Consistency.ONE), Map.of("k", utf8("v")));

      // Act & Assert
      assertThatThrownBy(() -> Frame.request(ProtocolVersion.V3, 1, request))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("V3");
    }
  }

  @Nested
  @DisplayName("Response decoding")
  class Decoding {

    @Test
    @DisplayName("READY decodes to the singleton")
    void decode_Ready_Singleton() {
      // Act
      final var message = decode(response(RESPONSE_V4, 0, Opcode.READY, b -> {}));

      // Assert
      assertThat(message).isSameAs(ReadyResponse.INSTANCE);
    }

    @Test
    @DisplayName("SUPPORTED options carry the sharding parameters")
    void decode_Supported_ShardingInfo() {
      // Arrange
      final var frame =
          response(
              RESPONSE_V4,
              0,
              Opcode.SUPPORTED,
              b -> {
                b.writeShort(4);
                CodecUtils.writeString(b, ShardingInfo.SHARD);
                CodecUtils.writeStringList(b, List.of("2"));
                CodecUtils.writeString(b, ShardingInfo.NR_SHARDS);
                CodecUtils.writeStringList(b, List.of("8"));
                CodecUtils.writeString(b, ShardingInfo.IGNORE_MSB);
                CodecUtils.writeStringList(b, List.of("12"));
                CodecUtils.writeString(b, ShardingInfo.SHARD_AWARE_PORT);
                CodecUtils.writeStringList(b, List.of("19042"));
              });

      // Act
      final var supported = (SupportedResponse) decode(frame);

      // Assert
      final var info = ShardingInfo.fromSupported(supported.options()).orElseThrow();
      assertThat(info.shard()).isEqualTo(2);
      assertThat(info.shardCount()).isEqualTo(8);
      assertThat(info.ignoreMsb()).isEqualTo(12);
      assertThat(info.shardAwarePort()).isEqualTo(19042);
    }

    @Test
    @DisplayName("ROWS with a global table spec and more pages")
    void decode_Rows_GlobalSpecAndPagingState() {
      // Arrange
      final var frame =
          response(
              RESPONSE_V4,
              0,
              Opcode.RESULT,
              b -> {
                b.writeInt(ResultMessage.KIND_ROWS);
                b.writeInt(0x0001 | 0x0002);
                b.writeInt(2);
                CodecUtils.writeBytes(b, new byte[] {9});
                CodecUtils.writeString(b, "ks");
                CodecUtils.writeString(b, "users");
                CodecUtils.writeString(b, "id");
                b.writeShort(DataType.INT);
                CodecUtils.writeString(b, "tags");
                b.writeShort(DataType.SET);
                b.writeShort(DataType.VARCHAR);
                b.writeInt(1);
                CodecUtils.writeBytes(b, new byte[] {0, 0, 0, 42});
                b.writeInt(-1);
              });

      // Act
      final var rows = (RowsResult) decode(frame);

      // Assert
      final var metadata = rows.metadata();
      assertThat(metadata.columns()).extracting(ColumnSpec::name).containsExactly("id", "tags");
      assertThat(metadata.columns()).extracting(ColumnSpec::table).containsOnly("users");
      assertThat(metadata.columns().get(1).type().parameters())
          .singleElement()
          .extracting(DataType::id)
          .isEqualTo(DataType.VARCHAR);
      assertThat(metadata.pagingState().get(0)).isEqualTo((byte) 9);
      assertThat(rows.rows()).hasSize(1);
      assertThat(rows.rows().get(0).get(0).getInt(0)).isEqualTo(42);
      assertThat(rows.rows().get(0).get(1)).isNull();
    }

    @Test
    @DisplayName("UNAVAILABLE keeps required and alive apart")
    void decode_Unavailable_RequiredAndAlive() {
      // Arrange
      final var frame =
          response(
              RESPONSE_V4,
              0,
              Opcode.ERROR,
              b -> {
                b.writeInt(ErrorCode.UNAVAILABLE.code());
                CodecUtils.writeString(b, "not enough replicas");
                b.writeShort(Consistency.QUORUM.code());
                b.writeInt(3);
                b.writeInt(1);
              });

      // Act
      final var error = (ErrorResponse) decode(frame);

      // Assert
      assertThat(error.code()).isEqualTo(ErrorCode.UNAVAILABLE);
      assertThat(error.blockFor()).isEqualTo(3);
      assertThat(error.received()).isEqualTo(1);
      assertThat(error.consistency()).isEqualTo(Consistency.QUORUM);
    }

    @Test
    @DisplayName("READ_FAILURE on v4 reports only a failure count")
    void decode_ReadFailureV4_CountOnly() {
      // Arrange
      final var frame =
          response(
              RESPONSE_V4,
              0,
              Opcode.ERROR,
              b -> {
                b.writeInt(ErrorCode.READ_FAILURE.code());
                CodecUtils.writeString(b, "failed");
                b.writeShort(Consistency.ONE.code());
                b.writeInt(0);
                b.writeInt(1);
                b.writeInt(2);
                b.writeByte(0);
              });

      // Act
      final var error = (ErrorResponse) decode(frame);

      // Assert
      assertThat(error.failures()).isEqualTo(2);
      assertThat(error.reasonMap()).isEmpty();
      assertThat(error.dataPresent()).isFalse();
    }

    @Test
    @DisplayName("READ_FAILURE on v5 carries a per-replica reason map")
    void decode_ReadFailureV5_ReasonMap() throws Exception {
      // Arrange
      final var replica = InetAddress.getByName("10.0.0.2");
      final var frame =
          response(
              RESPONSE_V5,
              0,
              Opcode.ERROR,
              b -> {
                b.writeInt(ErrorCode.READ_FAILURE.code());
                CodecUtils.writeString(b, "failed");
                b.writeShort(Consistency.ONE.code());
                b.writeInt(0);
                b.writeInt(1);
                b.writeInt(1);
                writeInetAddr(b, replica);
                b.writeShort(1);
                b.writeByte(1);
              });

      // Act
      final var error = (ErrorResponse) decode(frame);
      final var exception =
          (ReadFailureException) error.toException(new InetSocketAddress("10.0.0.1", 9042));

      // Assert
      assertThat(error.failures()).isEqualTo(1);
      assertThat(error.reasonMap()).containsEntry(replica, 1);
      assertThat(error.dataPresent()).isTrue();
      assertThat(exception.getReasonMap()).containsEntry(replica, 1);
    }

    @Test
    @DisplayName("STATUS_CHANGE event carries the node address")
    void decode_StatusChange_Event() throws Exception {
      // Arrange
      final var node = InetAddress.getByName("10.0.0.3");
      final var frame =
          response(
              RESPONSE_V4,
              0,
              Opcode.EVENT,
              b -> {
                CodecUtils.writeString(b, "STATUS_CHANGE");
                CodecUtils.writeString(b, "DOWN");
                writeInetAddr(b, node);
                b.writeInt(9042);
              });

      // Act
      final var event = (StatusChangeEvent) decode(frame);

      // Assert
      assertThat(event.status()).isEqualTo(StatusChangeEvent.Status.DOWN);
      assertThat(event.address()).isEqualTo(new InetSocketAddress("10.0.0.3", 9042));
      assertThat(event.opcode()).isEqualTo(Opcode.EVENT);
    }

    @Test
    @DisplayName("warnings are skipped before the body")
    void decode_WarningFlag_Skipped() {
      // Arrange
      final var frame =
          response(
              RESPONSE_V4,
              Frame.FLAG_WARNING,
              Opcode.RESULT,
              b -> {
                CodecUtils.writeStringList(b, List.of("Aggregation without partition key"));
                b.writeInt(ResultMessage.KIND_SET_KEYSPACE);
                CodecUtils.writeString(b, "ks");
              });

      // Act
      final var result = (SetKeyspaceResult) decode(frame);

      // Assert
      assertThat(result.keyspace()).isEqualTo("ks");
    }

    @Test
    @DisplayName("a custom payload is kept on the frame, after warnings and before the body")
    void decode_CustomPayload_KeptOnFrame() {
      // Arrange
      final var frame =
          response(
              RESPONSE_V4,
              Frame.FLAG_WARNING | Frame.FLAG_CUSTOM_PAYLOAD,
              Opcode.RESULT,
              b -> {
                CodecUtils.writeStringList(b, List.of("Batch too large"));
                final Map<String, ByteBuffer> payload = new LinkedHashMap<>();
                payload.put("k1", utf8("v1"));
                payload.put("k2", null);
                CodecUtils.writeBytesMap(b, payload);
                b.writeInt(ResultMessage.KIND_VOID);
              });

      // Act
      final Frame decoded;
      try {
        decoded = FrameDecoder.decodeFrame(frame);
      } finally {
        frame.release();
      }

      // Assert
      assertThat(decoded.message()).isSameAs(VoidResult.INSTANCE);
      assertThat(decoded.customPayload()).containsOnlyKeys("k1", "k2");
      assertThat(decoded.customPayload().get("k1")).isEqualTo(utf8("v1"));
      assertThat(decoded.customPayload().get("k2")).isNull();
    }

    @Test
    @DisplayName("frames without the payload flag have an empty payload")
    void decode_NoPayloadFlag_EmptyPayload() {
      // Arrange
      final var frame = response(RESPONSE_V4, 0, Opcode.READY, b -> {});

      // Act
      final Frame decoded;
      try {
        decoded = FrameDecoder.decodeFrame(frame);
      } finally {
        frame.release();
      }

      // Assert
      assertThat(decoded.customPayload()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Malformed input")
  class Malformed {

    @Test
    @DisplayName("a frame without the response bit is rejected")
    void decode_RequestFrame_Throws() {
      // Arrange
      final var frame = response(0x04, 0, Opcode.READY, b -> {});

      // Act & Assert
      assertThatThrownBy(() -> decode(frame))
          .isInstanceOf(FrameProtocolException.class)
          .hasMessageContaining("response frame");
    }

    @Test
    @DisplayName("compressed frames are rejected")
    void decode_Compressed_Throws() {
      // Arrange
      final var frame = response(RESPONSE_V4, Frame.FLAG_COMPRESSED, Opcode.READY, b -> {});

      // Act & Assert
      assertThatThrownBy(() -> decode(frame)).isInstanceOf(FrameProtocolException.class);
    }

    @Test
    @DisplayName("a truncated body surfaces as a protocol error")
    void decode_TruncatedBody_Throws() {
      // Arrange
      final var frame =
          response(RESPONSE_V4, 0, Opcode.RESULT, b -> b.writeInt(ResultMessage.KIND_SET_KEYSPACE));

      // Act & Assert
      assertThatThrownBy(() -> decode(frame)).isInstanceOf(FrameProtocolException.class);
    }
  }

  @Nested
  @DisplayName("Stream framing")
  class StreamFraming {

    @Test
    @DisplayName("a frame split across reads is reassembled")
    void channel_SplitFrame_DecodedOnce() {
      // Arrange
      final var channel = new EmbeddedChannel(new FrameDecoder());
      final var frame =
          response(
              RESPONSE_V4,
              0,
              Opcode.RESULT,
              b -> {
                b.writeInt(ResultMessage.KIND_SET_KEYSPACE);
                CodecUtils.writeString(b, "split");
              });
      final var head = frame.readRetainedSlice(6);
      final var tail = frame.readRetainedSlice(frame.readableBytes());
      frame.release();

      // Act
      channel.writeInbound(head);
      final Frame beforeTail = channel.readInbound();
      channel.writeInbound(tail);
      final Frame decoded = channel.readInbound();

      // Assert
      assertThat(beforeTail).isNull();
      assertThat(decoded.streamId()).isEqualTo(7);
      assertThat(decoded.version()).isEqualTo(ProtocolVersion.V4);
      assertThat(((SetKeyspaceResult) decoded.message()).keyspace()).isEqualTo("split");
      assertThat(channel.finish()).isFalse();
    }

    @Test
    @DisplayName("two frames in one read come out in order")
    void channel_TwoFrames_BothDecoded() {
      // Arrange
      final var channel = new EmbeddedChannel(new FrameDecoder());
      final var combined = Unpooled.buffer();
      final var ready = response(RESPONSE_V4, 0, Opcode.READY, b -> {});
      final var text = "x".getBytes(StandardCharsets.UTF_8);
      final var keyspace =
          response(
              RESPONSE_V4,
              0,
              Opcode.RESULT,
              b -> {
                b.writeInt(ResultMessage.KIND_SET_KEYSPACE);
                b.writeShort(text.length);
                b.writeBytes(text);
              });
      combined.writeBytes(ready).writeBytes(keyspace);
      ready.release();
      keyspace.release();

      // Act
      channel.writeInbound(combined);
      final Frame first = channel.readInbound();
      final Frame second = channel.readInbound();

      // Assert
      assertThat(first.message()).isSameAs(ReadyResponse.INSTANCE);
      assertThat(((SetKeyspaceResult) second.message()).keyspace()).isEqualTo("x");
      channel.finishAndReleaseAll();
    }
  }
}
