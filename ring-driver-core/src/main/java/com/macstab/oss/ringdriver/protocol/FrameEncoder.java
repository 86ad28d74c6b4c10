/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Writes request frames: header with a back-patched body length, then the custom payload (when
 * flagged) and the body.
 */
@Sharable
public final class FrameEncoder extends MessageToByteEncoder<Frame> {

  public static final FrameEncoder INSTANCE = new FrameEncoder();

  @Override
  protected void encode(final ChannelHandlerContext ctx, final Frame frame, final ByteBuf out) {
    encodeFrame(frame, out);
  }

  /**
   * Encodes a request frame.
   *
   * @param frame frame whose message is a {@link Request}
   * @param out target buffer
   */
  public static void encodeFrame(final Frame frame, final ByteBuf out) {
    final var request = (Request) frame.message();
    out.writeByte(frame.version().code());
    out.writeByte(frame.flags());
    out.writeShort(frame.streamId());
    out.writeByte(request.opcode().code());
    final int lengthIndex = out.writerIndex();
    out.writeInt(0);
    final int bodyStart = out.writerIndex();
    if ((frame.flags() & Frame.FLAG_CUSTOM_PAYLOAD) != 0) {
      CodecUtils.writeBytesMap(out, frame.customPayload());
    }
    request.encode(out, frame.version());
    out.setInt(lengthIndex, out.writerIndex() - bodyStart);
  }
}
