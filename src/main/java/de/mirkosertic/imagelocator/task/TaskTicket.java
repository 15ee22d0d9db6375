package de.mirkosertic.imagelocator.task;

import java.time.Instant;

/**
 * Identifies one submitted task. Returned to the caller on submission and carried by every message about it.
 */
public record TaskTicket(long id, TaskKind kind, Instant requestedAt) {
}
