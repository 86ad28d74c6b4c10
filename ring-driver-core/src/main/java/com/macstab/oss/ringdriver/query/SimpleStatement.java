/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.query;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.macstab.oss.ringdriver.protocol.QueryParameters;
import com.macstab.oss.ringdriver.protocol.QueryRequest;
import com.macstab.oss.ringdriver.protocol.Request;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A query string with positional, already serialized values.
 *
 * <pre>{@code
 * SimpleStatement stmt = SimpleStatement.builder()
 *     .query("SELECT * FROM ks.users WHERE id = ?")
 *     .value(idBytes)
 *     .routingKey(idBytes)
 *     .keyspace("ks")
 *     .idempotent(true)
 *     .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
public class SimpleStatement implements Statement {

  private static final Pattern USE_STATEMENT =
      Pattern.compile("^\\s*USE\\b", Pattern.CASE_INSENSITIVE);

  @NonNull String query;
  @Singular List<ByteBuffer> values;
  Consistency consistency;
  Consistency serialConsistency;
  boolean idempotent;
  String keyspace;
  ByteBuffer routingKey;
  int pageSize;
  ByteBuffer pagingState;
  Duration timeout;
  @Builder.Default long defaultTimestamp = Long.MIN_VALUE;
  @NonNull @Builder.Default Map<String, ByteBuffer> customPayload = Map.of();

  public static SimpleStatement of(final String query, final ByteBuffer... values) {
    return builder().query(query).values(Arrays.asList(values)).build();
  }

  /** Copy resuming at the page described by {@code state}. */
  public SimpleStatement withPagingState(final ByteBuffer state) {
    return toBuilder().pagingState(state).build();
  }

  /**
   * Whether the query switches keyspace. Sessions reject such statements: the keyspace is fixed
   * per session and set on every connection while it opens.
   */
  public boolean isUseStatement() {
    return USE_STATEMENT.matcher(query).find();
  }

  @Override
  public Request toRequest(final StatementDefaults defaults) {
    final var parameters =
        new QueryParameters(
            consistency != null ? consistency : defaults.consistency(),
            values,
            pageSize > 0 ? pageSize : defaults.pageSize(),
            pagingState,
            serialConsistency != null ? serialConsistency : defaults.serialConsistency(),
            defaultTimestamp);
    return new QueryRequest(query, parameters, customPayload);
  }

  @Override
  public String toString() {
    final var text = query.length() > 100 ? query.substring(0, 100) + "..." : query;
    return "SimpleStatement[" + text.strip() + ", values=" + values.size() + "]";
  }
}
