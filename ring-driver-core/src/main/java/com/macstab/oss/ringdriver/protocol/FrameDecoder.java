/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.nio.ByteBuffer;
import java.util.Map;

import com.macstab.oss.ringdriver.error.FrameProtocolException;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits the inbound byte stream into frames and decodes each into a {@link Frame}.
 *
 * <p><strong>Header layout (9 bytes):</strong> version (response bit {@code 0x80} set), flags,
 * stream id [short], opcode [byte], body length [int]. Length field offset 5, length 4.
 *
 * <p>Response flags are honoured before the body is decoded, in this order: a tracing id (16
 * bytes) is skipped, a warnings string list is logged, and a custom payload bytes map is kept on
 * the {@link Frame}. Compressed frames are rejected since compression is never negotiated.
 */
@Slf4j
public final class FrameDecoder extends LengthFieldBasedFrameDecoder {

  private static final int LENGTH_FIELD_OFFSET = 5;
  private static final int LENGTH_FIELD_LENGTH = 4;

  public FrameDecoder() {
    super(
        Frame.HEADER_LENGTH + Frame.MAX_BODY_LENGTH,
        LENGTH_FIELD_OFFSET,
        LENGTH_FIELD_LENGTH,
        0,
        0,
        true);
  }

  @Override
  protected Object decode(final ChannelHandlerContext ctx, final ByteBuf in) throws Exception {
    final var buffer = (ByteBuf) super.decode(ctx, in);
    if (buffer == null) {
      return null;
    }
    try {
      return decodeFrame(buffer);
    } finally {
      buffer.release();
    }
  }

  /**
   * Decodes one complete frame (header and body).
   *
   * @param buffer exactly one frame
   * @return decoded frame
   */
  public static Frame decodeFrame(final ByteBuf buffer) {
    final int versionByte = buffer.readUnsignedByte();
    if ((versionByte & Frame.RESPONSE_BIT) == 0) {
      throw new FrameProtocolException(
          "Expected a response frame, got version byte " + versionByte);
    }
    final ProtocolVersion version;
    try {
      version = ProtocolVersion.fromCode(versionByte & 0x7F);
    } catch (final IllegalArgumentException e) {
      throw new FrameProtocolException(e.getMessage(), e);
    }
    final int flags = buffer.readUnsignedByte();
    final int streamId = buffer.readShort();
    final var opcode = Opcode.fromCode(buffer.readUnsignedByte());
    final int length = buffer.readInt();
    if ((flags & Frame.FLAG_COMPRESSED) != 0) {
      throw new FrameProtocolException("Compressed frames are not supported");
    }
    final var body = buffer.readSlice(length);
    if ((flags & Frame.FLAG_TRACING) != 0) {
      body.skipBytes(16);
    }
    if ((flags & Frame.FLAG_WARNING) != 0) {
      final var warnings = CodecUtils.readStringList(body);
      if (log.isWarnEnabled()) {
        log.warn("Server warnings on stream {}: {}", streamId, warnings);
      }
    }
    final Map<String, ByteBuffer> payload =
        (flags & Frame.FLAG_CUSTOM_PAYLOAD) != 0 ? CodecUtils.readBytesMap(body) : Map.of();
    try {
      return new Frame(
          version, flags, streamId, ResponseDecoder.decode(opcode, version, body), payload);
    } catch (final IndexOutOfBoundsException | IllegalArgumentException e) {
      throw new FrameProtocolException("Malformed " + opcode + " body", e);
    }
  }
}
