package de.mirkosertic.imagelocator.task;

import de.mirkosertic.imagelocator.ErrorKind;

/**
 * Terminal failure of a task. The message is meant to be shown to the user as is.
 */
public record TaskFailed(TaskTicket ticket, String message, ErrorKind errorKind) implements TaskMessage {
}
