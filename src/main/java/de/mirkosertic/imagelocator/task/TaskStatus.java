package de.mirkosertic.imagelocator.task;

public record TaskStatus(TaskTicket ticket, TaskState state) {

    public boolean isActive() {
        return state == TaskState.REQUESTED || state == TaskState.RUNNING;
    }
}
