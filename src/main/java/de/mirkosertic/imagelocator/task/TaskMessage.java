package de.mirkosertic.imagelocator.task;

/**
 * A message delivered from a background task to the interactive layer.
 */
public interface TaskMessage {

    TaskTicket ticket();
}
