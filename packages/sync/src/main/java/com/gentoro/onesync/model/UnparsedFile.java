package com.gentoro.onesync.model;

import java.time.Instant;

/**
 * A source file that could not be interpreted during the last load pass.
 *
 * @param path source path (filesystem path or repository path)
 * @param error parser error text
 * @param timestamp when the failure was recorded
 * @param source {@code local} or {@code remote}; may be {@code null} for older documents
 */
public record UnparsedFile(String path, String error, Instant timestamp, String source) {}
