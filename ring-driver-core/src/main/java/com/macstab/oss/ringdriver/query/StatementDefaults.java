/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.query;

import lombok.NonNull;

/**
 * Session-wide values for options a statement leaves unset.
 *
 * @param consistency default consistency
 * @param serialConsistency default serial consistency
 * @param pageSize default page size, {@code <= 0} disables paging
 */
public record StatementDefaults(
    @NonNull Consistency consistency, @NonNull Consistency serialConsistency, int pageSize) {}
