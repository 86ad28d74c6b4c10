/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.query;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import com.macstab.oss.ringdriver.protocol.SchemaChange;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * How a result was obtained.
 *
 * <p>{@code errors} holds the failures of the attempts that did not win, keyed by the host they
 * were sent to. {@code schemaInAgreement} is false only when a schema-changing statement
 * succeeded but the cluster did not converge before the agreement timeout. {@code
 * incomingPayload} is the custom payload the coordinator attached to its response, empty when it
 * sent none.
 */
@Value
@Builder
public class ExecutionInfo {

  InetSocketAddress coordinator;
  @Singular("triedHost") List<InetSocketAddress> triedHosts;
  @Singular Map<InetSocketAddress, Throwable> errors;
  int attempts;
  int speculativeExecutions;
  @Builder.Default boolean schemaInAgreement = true;
  SchemaChange schemaChange;
  @Builder.Default Map<String, ByteBuffer> incomingPayload = Map.of();
}
