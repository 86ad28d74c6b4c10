/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.nio.ByteBuffer;
import java.util.Map;

/**
 * Decoded frame: header fields plus the decoded message.
 *
 * <p>{@code streamId} correlates responses with requests; negative stream ids are reserved for
 * server-initiated EVENT frames.
 *
 * @param version protocol version from the header
 * @param flags header flags
 * @param streamId stream id
 * @param message decoded body
 * @param customPayload bytes map preceding the body when {@link #FLAG_CUSTOM_PAYLOAD} is set,
 *     empty otherwise
 */
public record Frame(
    ProtocolVersion version,
    int flags,
    int streamId,
    Message message,
    Map<String, ByteBuffer> customPayload) {

  public static final int HEADER_LENGTH = 9;
  public static final int RESPONSE_BIT = 0x80;

  public static final int FLAG_COMPRESSED = 0x01;
  public static final int FLAG_TRACING = 0x02;
  public static final int FLAG_CUSTOM_PAYLOAD = 0x04;
  public static final int FLAG_WARNING = 0x08;

  /** Largest body the decoder accepts (256 MiB, the server-side default ceiling). */
  public static final int MAX_BODY_LENGTH = 256 * 1024 * 1024;

  public Frame {
    customPayload = CustomPayloads.copyOf(customPayload);
  }

  public Frame(
      final ProtocolVersion version, final int flags, final int streamId, final Message message) {
    this(version, flags, streamId, message, Map.of());
  }

  /**
   * Request frame; sets {@link #FLAG_CUSTOM_PAYLOAD} when the request carries a payload.
   *
   * @param version negotiated protocol version
   * @param streamId stream id
   * @param r request
   * @return frame to encode
   * @throws IllegalArgumentException if the request carries a payload {@code version} cannot
   */
  public static Frame request(final ProtocolVersion version, final int streamId, final Request r) {
    final var payload = r.customPayload();
    if (payload.isEmpty()) {
      return new Frame(version, 0, streamId, r);
    }
    if (!version.hasCustomPayload()) {
      throw new IllegalArgumentException(
          "Custom payloads require protocol V4 or later, connection uses " + version);
    }
    return new Frame(version, FLAG_CUSTOM_PAYLOAD, streamId, r, payload);
  }

  public boolean isEvent() {
    return message.opcode() == Opcode.EVENT;
  }
}
