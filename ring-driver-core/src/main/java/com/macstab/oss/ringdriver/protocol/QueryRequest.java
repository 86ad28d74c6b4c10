/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.nio.ByteBuffer;
import java.util.Map;

import io.netty.buffer.ByteBuf;
import lombok.NonNull;

/**
 * QUERY: executes a query string.
 *
 * @param query query text
 * @param parameters consistency, values and paging
 * @param customPayload sent in the frame ahead of the body, empty for none
 */
public record QueryRequest(
    @NonNull String query,
    @NonNull QueryParameters parameters,
    Map<String, ByteBuffer> customPayload)
    implements Request {

  public QueryRequest {
    customPayload = CustomPayloads.copyOf(customPayload);
  }

  public QueryRequest(final String query, final QueryParameters parameters) {
    this(query, parameters, Map.of());
  }

  @Override
  public Opcode opcode() {
    return Opcode.QUERY;
  }

  @Override
  public void encode(final ByteBuf out, final ProtocolVersion version) {
    CodecUtils.writeLongString(out, query);
    parameters.encode(out, version);
  }
}
