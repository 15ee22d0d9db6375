package de.mirkosertic.imagelocator.task;

public enum TaskState {
    REQUESTED,
    RUNNING,
    COMPLETED,
    FAILED
}
