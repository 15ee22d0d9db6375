package de.mirkosertic.imagelocator.reveal;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Shows a file in the platform file manager.
 */
public interface FileRevealer {

    void reveal(Path file) throws IOException;
}
