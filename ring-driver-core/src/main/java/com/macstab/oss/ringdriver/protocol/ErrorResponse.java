/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;

import com.macstab.oss.ringdriver.error.AuthenticationException;
import com.macstab.oss.ringdriver.error.BootstrappingException;
import com.macstab.oss.ringdriver.error.DriverException;
import com.macstab.oss.ringdriver.error.ErrorCode;
import com.macstab.oss.ringdriver.error.FrameProtocolException;
import com.macstab.oss.ringdriver.error.OverloadedException;
import com.macstab.oss.ringdriver.error.QueryValidationException;
import com.macstab.oss.ringdriver.error.ReadFailureException;
import com.macstab.oss.ringdriver.error.ReadTimeoutException;
import com.macstab.oss.ringdriver.error.ServerErrorException;
import com.macstab.oss.ringdriver.error.UnavailableException;
import com.macstab.oss.ringdriver.error.WriteFailureException;
import com.macstab.oss.ringdriver.error.WriteTimeoutException;
import com.macstab.oss.ringdriver.query.Consistency;

import io.netty.buffer.ByteBuf;

/**
 * ERROR frame body with the code-specific detail already decoded.
 *
 * <p>Fields that a code does not carry keep their zero value. {@code reasonMap} is only filled for
 * protocol v5 READ_FAILURE/WRITE_FAILURE; v3/v4 send just the {@code failures} count.
 *
 * @param code error code
 * @param message server message
 * @param consistency consistency of the failed request
 * @param received replicas that answered
 * @param blockFor replicas required
 * @param failures replicas that failed
 * @param reasonMap replica to failure code (v5 only)
 * @param dataPresent whether the data replica answered (reads)
 * @param writeType SIMPLE, BATCH, COUNTER, CAS... (writes)
 */
public record ErrorResponse(
    ErrorCode code,
    String message,
    Consistency consistency,
    int received,
    int blockFor,
    int failures,
    Map<InetAddress, Integer> reasonMap,
    boolean dataPresent,
    String writeType)
    implements Message {

  public ErrorResponse {
    reasonMap = reasonMap == null ? Map.of() : Map.copyOf(reasonMap);
  }

  public static ErrorResponse simple(final ErrorCode code, final String message) {
    return new ErrorResponse(code, message, null, 0, 0, 0, Map.of(), false, null);
  }

  @Override
  public Opcode opcode() {
    return Opcode.ERROR;
  }

  /**
   * Builds the typed exception for this error.
   *
   * @param coordinator node that answered
   * @return exception to complete the request with
   */
  public DriverException toException(final InetSocketAddress coordinator) {
    switch (code) {
      case UNAVAILABLE:
        return new UnavailableException(coordinator, message, consistency, blockFor, received);
      case WRITE_TIMEOUT:
      case CAS_WRITE_UNKNOWN:
        return new WriteTimeoutException(
            coordinator, code, message, consistency, received, blockFor, writeType);
      case READ_TIMEOUT:
        return new ReadTimeoutException(
            coordinator, message, consistency, received, blockFor, dataPresent);
      case READ_FAILURE:
        return new ReadFailureException(
            coordinator, message, consistency, received, blockFor, failures, reasonMap,
            dataPresent);
      case WRITE_FAILURE:
      case CDC_WRITE_FAILURE:
        return new WriteFailureException(
            coordinator, code, message, consistency, received, blockFor, failures, reasonMap,
            writeType);
      case OVERLOADED:
        return new OverloadedException(coordinator, message);
      case IS_BOOTSTRAPPING:
        return new BootstrappingException(coordinator, message);
      case AUTH_ERROR:
        return new AuthenticationException(coordinator, message);
      case PROTOCOL_ERROR:
        return new FrameProtocolException("[" + coordinator + "] " + message);
      case SERVER_ERROR:
      case TRUNCATE_ERROR:
        return new ServerErrorException(coordinator, code, message);
      default:
        return new QueryValidationException(coordinator, code, message);
    }
  }

  static ErrorResponse decode(final ByteBuf in, final ProtocolVersion version) {
    final var code = ErrorCode.fromCode(in.readInt());
    final var message = CodecUtils.readString(in);
    switch (code) {
      case UNAVAILABLE:
        {
          final var cl = Consistency.fromCode(in.readUnsignedShort());
          final int required = in.readInt();
          final int alive = in.readInt();
          return new ErrorResponse(code, message, cl, alive, required, 0, Map.of(), false, null);
        }
      case WRITE_TIMEOUT:
        {
          final var cl = Consistency.fromCode(in.readUnsignedShort());
          final int received = in.readInt();
          final int blockFor = in.readInt();
          final var writeType = CodecUtils.readString(in);
          if (version.hasFailureReasonMap() && "CAS".equals(writeType) && in.isReadable(2)) {
            in.readUnsignedShort();
          }
          return new ErrorResponse(
              code, message, cl, received, blockFor, 0, Map.of(), false, writeType);
        }
      case READ_TIMEOUT:
        {
          final var cl = Consistency.fromCode(in.readUnsignedShort());
          final int received = in.readInt();
          final int blockFor = in.readInt();
          final boolean dataPresent = in.readByte() != 0;
          return new ErrorResponse(
              code, message, cl, received, blockFor, 0, Map.of(), dataPresent, null);
        }
      case READ_FAILURE:
        {
          final var cl = Consistency.fromCode(in.readUnsignedShort());
          final int received = in.readInt();
          final int blockFor = in.readInt();
          final Map<InetAddress, Integer> reasons = readFailures(in, version);
          final int failures = version.hasFailureReasonMap() ? reasons.size() : in.readInt();
          final boolean dataPresent = in.readByte() != 0;
          return new ErrorResponse(
              code, message, cl, received, blockFor, failures, reasons, dataPresent, null);
        }
      case WRITE_FAILURE:
        {
          final var cl = Consistency.fromCode(in.readUnsignedShort());
          final int received = in.readInt();
          final int blockFor = in.readInt();
          final Map<InetAddress, Integer> reasons = readFailures(in, version);
          final int failures = version.hasFailureReasonMap() ? reasons.size() : in.readInt();
          final var writeType = CodecUtils.readString(in);
          return new ErrorResponse(
              code, message, cl, received, blockFor, failures, reasons, false, writeType);
        }
      case CAS_WRITE_UNKNOWN:
        {
          final var cl = Consistency.fromCode(in.readUnsignedShort());
          final int received = in.readInt();
          final int blockFor = in.readInt();
          return new ErrorResponse(
              code, message, cl, received, blockFor, 0, Map.of(), false, "CAS");
        }
      default:
        // remaining detail (already-exists table, unprepared id, function name) is not used
        in.skipBytes(in.readableBytes());
        return simple(code, message);
    }
  }

  private static Map<InetAddress, Integer> readFailures(
      final ByteBuf in, final ProtocolVersion version) {
    if (!version.hasFailureReasonMap()) {
      return Map.of();
    }
    final int n = in.readInt();
    final Map<InetAddress, Integer> reasons = new LinkedHashMap<>();
    for (int i = 0; i < n; i++) {
      final var address = CodecUtils.readInetAddr(in);
      reasons.put(address, in.readUnsignedShort());
    }
    return reasons;
  }
}
