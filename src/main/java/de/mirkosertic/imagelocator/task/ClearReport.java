package de.mirkosertic.imagelocator.task;

public record ClearReport(long removedFiles, long removedReferenceIds) {
}
