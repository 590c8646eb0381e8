package com.opencalsync.sync.conflict;

import java.time.LocalDate;

/**
 * Half-open date range {@code [start, end)}.
 */
public record DateSpan(LocalDate start, LocalDate end) {
}
