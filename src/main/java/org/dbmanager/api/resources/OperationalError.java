package org.dbmanager.api.resources;

import java.time.Instant;

/**
 * An operational error recorded by a database manager.
 *
 * @param timestamp When the error occurred.
 * @param errorType A category for the error (e.g., "CONNECTION_FAILED", "COMMAND_FAILED").
 * @param message   A human-readable description of the error.
 * @param details   Additional context, such as the batch command or the database name.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
