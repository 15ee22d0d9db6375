package de.mirkosertic.imagelocator.task;

public record TaskProgress(TaskTicket ticket, long processed, long total) implements TaskMessage {

    /**
     * Completion in percent, 0 when the total is not known yet.
     */
    public int percent() {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.min(100, processed * 100 / total);
    }
}
