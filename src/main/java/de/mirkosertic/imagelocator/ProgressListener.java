package de.mirkosertic.imagelocator;

/**
 * Receives progress updates from long-running operations. May be called from worker threads.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (processed, total) -> {
    };

    void onProgress(long processed, long total);
}
