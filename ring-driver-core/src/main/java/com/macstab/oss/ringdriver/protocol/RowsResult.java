/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * RESULT of kind Rows.
 *
 * @param metadata column specs and paging state
 * @param rows raw cell values per row, null cells as {@code null}
 */
public record RowsResult(RowsMetadata metadata, List<List<ByteBuffer>> rows)
    implements ResultMessage {}
