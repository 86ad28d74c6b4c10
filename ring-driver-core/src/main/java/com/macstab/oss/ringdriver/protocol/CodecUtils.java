/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.macstab.oss.ringdriver.error.FrameProtocolException;

import io.netty.buffer.ByteBuf;

/**
 * Reads and writes the protocol's notation types.
 *
 * <p><strong>Notation:</strong> {@code [short]}/{@code [int]}/{@code [long]} are big-endian;
 * {@code [string]} is a {@code [short]} length plus UTF-8; {@code [long string]} uses an {@code
 * [int]} length; {@code [bytes]} is an {@code [int]} length where a negative length means null;
 * {@code [inet]} is a length byte, 4 or 16 address bytes and an {@code [int]} port.
 */
public final class CodecUtils {

  private CodecUtils() {}

  public static String readString(final ByteBuf in) {
    final int length = in.readUnsignedShort();
    return readUtf8(in, length);
  }

  public static String readLongString(final ByteBuf in) {
    final int length = in.readInt();
    if (length < 0) {
      return null;
    }
    return readUtf8(in, length);
  }

  public static void writeString(final ByteBuf out, final String value) {
    final var bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length > 0xFFFF) {
      throw new IllegalArgumentException("String too long for [string]: " + bytes.length);
    }
    out.writeShort(bytes.length);
    out.writeBytes(bytes);
  }

  public static void writeLongString(final ByteBuf out, final String value) {
    final var bytes = value.getBytes(StandardCharsets.UTF_8);
    out.writeInt(bytes.length);
    out.writeBytes(bytes);
  }

  public static List<String> readStringList(final ByteBuf in) {
    final int n = in.readUnsignedShort();
    final List<String> result = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      result.add(readString(in));
    }
    return result;
  }

  public static void writeStringList(final ByteBuf out, final List<String> values) {
    out.writeShort(values.size());
    for (final var v : values) {
      writeString(out, v);
    }
  }

  public static void writeStringMap(final ByteBuf out, final Map<String, String> values) {
    out.writeShort(values.size());
    for (final var e : values.entrySet()) {
      writeString(out, e.getKey());
      writeString(out, e.getValue());
    }
  }

  public static Map<String, List<String>> readStringMultimap(final ByteBuf in) {
    final int n = in.readUnsignedShort();
    final Map<String, List<String>> result = new LinkedHashMap<>();
    for (int i = 0; i < n; i++) {
      final var key = readString(in);
      result.put(key, readStringList(in));
    }
    return result;
  }

  /**
   * Reads {@code [bytes]}.
   *
   * @param in source
   * @return heap copy, {@code null} for a negative length
   */
  public static ByteBuffer readBytes(final ByteBuf in) {
    final int length = in.readInt();
    if (length < 0) {
      return null;
    }
    checkReadable(in, length);
    final var bytes = new byte[length];
    in.readBytes(bytes);
    return ByteBuffer.wrap(bytes);
  }

  public static void skipBytes(final ByteBuf in) {
    final int length = in.readInt();
    if (length > 0) {
      checkReadable(in, length);
      in.skipBytes(length);
    }
  }

  public static void writeBytes(final ByteBuf out, final ByteBuffer value) {
    if (value == null) {
      out.writeInt(-1);
      return;
    }
    out.writeInt(value.remaining());
    out.writeBytes(value.duplicate());
  }

  public static void writeBytes(final ByteBuf out, final byte[] value) {
    if (value == null) {
      out.writeInt(-1);
      return;
    }
    out.writeInt(value.length);
    out.writeBytes(value);
  }

  public static byte[] readShortBytes(final ByteBuf in) {
    final int length = in.readUnsignedShort();
    checkReadable(in, length);
    final var bytes = new byte[length];
    in.readBytes(bytes);
    return bytes;
  }

  /**
   * Reads a {@code [bytes map]} (custom payload).
   *
   * @param in source
   * @return entries in wire order; values may be null
   */
  public static Map<String, ByteBuffer> readBytesMap(final ByteBuf in) {
    final int n = in.readUnsignedShort();
    final Map<String, ByteBuffer> result = new LinkedHashMap<>();
    for (int i = 0; i < n; i++) {
      final var key = readString(in);
      result.put(key, readBytes(in));
    }
    return result;
  }

  public static void writeBytesMap(final ByteBuf out, final Map<String, ByteBuffer> values) {
    out.writeShort(values.size());
    for (final var e : values.entrySet()) {
      writeString(out, e.getKey());
      writeBytes(out, e.getValue());
    }
  }

  public static UUID readUuid(final ByteBuf in) {
    return new UUID(in.readLong(), in.readLong());
  }

  public static InetAddress readInetAddr(final ByteBuf in) {
    final int length = in.readUnsignedByte();
    if (length != 4 && length != 16) {
      throw new FrameProtocolException("Invalid inet address length: " + length);
    }
    final var bytes = new byte[length];
    in.readBytes(bytes);
    try {
      return InetAddress.getByAddress(bytes);
    } catch (final UnknownHostException e) {
      throw new FrameProtocolException("Invalid inet address", e);
    }
  }

  public static InetSocketAddress readInet(final ByteBuf in) {
    final var address = readInetAddr(in);
    return new InetSocketAddress(address, in.readInt());
  }

  private static String readUtf8(final ByteBuf in, final int length) {
    checkReadable(in, length);
    final var s = in.toString(in.readerIndex(), length, StandardCharsets.UTF_8);
    in.skipBytes(length);
    return s;
  }

  private static void checkReadable(final ByteBuf in, final int length) {
    if (in.readableBytes() < length) {
      throw new FrameProtocolException(
          "Truncated body: need " + length + " bytes, have " + in.readableBytes());
    }
  }
}
