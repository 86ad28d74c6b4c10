/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import com.macstab.oss.ringdriver.error.FrameProtocolException;

import io.netty.buffer.ByteBuf;

/** Decodes response and event bodies by opcode. */
public final class ResponseDecoder {

  private ResponseDecoder() {}

  /**
   * Decodes one body. Tracing id, warnings and custom payload must already be skipped.
   *
   * @param opcode frame opcode
   * @param version frame protocol version
   * @param body body bytes
   * @return decoded message
   * @throws FrameProtocolException for request opcodes or malformed bodies
   */
  public static Message decode(
      final Opcode opcode, final ProtocolVersion version, final ByteBuf body) {
    switch (opcode) {
      case READY:
        return ReadyResponse.INSTANCE;
      case AUTHENTICATE:
        return new AuthenticateResponse(CodecUtils.readString(body));
      case AUTH_CHALLENGE:
        return new AuthChallengeResponse(toArray(CodecUtils.readBytes(body)));
      case AUTH_SUCCESS:
        return new AuthSuccessResponse(toArray(CodecUtils.readBytes(body)));
      case SUPPORTED:
        return new SupportedResponse(CodecUtils.readStringMultimap(body));
      case ERROR:
        return ErrorResponse.decode(body, version);
      case RESULT:
        return decodeResult(body);
      case EVENT:
        return decodeEvent(body);
      default:
        throw new FrameProtocolException("Unexpected opcode in response: " + opcode);
    }
  }

  private static ResultMessage decodeResult(final ByteBuf body) {
    final int kind = body.readInt();
    switch (kind) {
      case ResultMessage.KIND_VOID:
        return VoidResult.INSTANCE;
      case ResultMessage.KIND_ROWS:
        {
          final var metadata = RowsMetadata.decode(body);
          final int rowCount = body.readInt();
          final List<List<ByteBuffer>> rows = new ArrayList<>(rowCount);
          for (int r = 0; r < rowCount; r++) {
            final List<ByteBuffer> row = new ArrayList<>(metadata.columnCount());
            for (int c = 0; c < metadata.columnCount(); c++) {
              row.add(CodecUtils.readBytes(body));
            }
            rows.add(row);
          }
          return new RowsResult(metadata, rows);
        }
      case ResultMessage.KIND_SET_KEYSPACE:
        return new SetKeyspaceResult(CodecUtils.readString(body));
      case ResultMessage.KIND_SCHEMA_CHANGE:
        return new SchemaChangeResult(SchemaChange.decode(body));
      default:
        throw new FrameProtocolException("Unsupported result kind: " + kind);
    }
  }

  private static ProtocolEvent decodeEvent(final ByteBuf body) {
    final var type = CodecUtils.readString(body);
    switch (type) {
      case "TOPOLOGY_CHANGE":
        {
          final var change = TopologyChangeEvent.Change.valueOf(CodecUtils.readString(body));
          final InetSocketAddress address = CodecUtils.readInet(body);
          return new TopologyChangeEvent(change, address);
        }
      case "STATUS_CHANGE":
        {
          final var status = StatusChangeEvent.Status.valueOf(CodecUtils.readString(body));
          return new StatusChangeEvent(status, CodecUtils.readInet(body));
        }
      case "SCHEMA_CHANGE":
        return new SchemaChangeEvent(SchemaChange.decode(body));
      default:
        throw new FrameProtocolException("Unknown event type: " + type);
    }
  }

  private static byte[] toArray(final ByteBuffer buffer) {
    if (buffer == null) {
      return null;
    }
    final var bytes = new byte[buffer.remaining()];
    buffer.duplicate().get(bytes);
    return bytes;
  }
}
