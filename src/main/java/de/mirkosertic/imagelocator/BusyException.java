package de.mirkosertic.imagelocator;

import de.mirkosertic.imagelocator.task.TaskKind;

/**
 * A task of the same kind is still running. Requests are rejected, never queued.
 */
public class BusyException extends LocatorException {

    private final TaskKind taskKind;

    public BusyException(final TaskKind taskKind) {
        super(ErrorKind.BUSY, "Another " + taskKind.displayName() + " is still running, please wait until it has finished");
        this.taskKind = taskKind;
    }

    public TaskKind getTaskKind() {
        return taskKind;
    }
}
