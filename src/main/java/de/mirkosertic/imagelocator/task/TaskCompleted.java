package de.mirkosertic.imagelocator.task;

public record TaskCompleted(TaskTicket ticket, Object payload) implements TaskMessage {

    /**
     * Typed access to the task result.
     *
     * @throws ClassCastException if the payload is not of the requested type
     */
    public <T> T payload(final Class<T> type) {
        return type.cast(payload);
    }
}
