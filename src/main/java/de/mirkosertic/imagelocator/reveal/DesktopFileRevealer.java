package de.mirkosertic.imagelocator.reveal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Opens the platform file manager on a file.
 * <p>
 * Windows and macOS select the file itself. On Linux the containing directory is opened with
 * the first file manager that can be started.
 */
public class DesktopFileRevealer implements FileRevealer {

    private static final Logger logger = LoggerFactory.getLogger(DesktopFileRevealer.class);

    private static final List<String> LINUX_OPENERS = List.of("xdg-open", "nautilus", "dolphin", "thunar", "nemo");

    private final String os;

    public DesktopFileRevealer() {
        this(System.getProperty("os.name"));
    }

    DesktopFileRevealer(final String osName) {
        this.os = osName.toLowerCase(Locale.ROOT);
        logger.debug("DesktopFileRevealer initialized for OS: {}", os);
    }

    @Override
    public void reveal(final Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new FileNotFoundException("File does not exist: " + file);
        }

        IOException lastFailure = null;
        for (final List<String> command : commandsFor(file.toAbsolutePath())) {
            try {
                new ProcessBuilder(command).start();
                logger.info("Revealed {} using {}", file, command.get(0));
                return;
            } catch (final IOException e) {
                logger.debug("Could not start {}: {}", command.get(0), e.getMessage());
                lastFailure = e;
            }
        }
        throw new IOException("No file manager could be started for " + file, lastFailure);
    }

    /**
     * Candidate commands in the order they are tried.
     */
    List<List<String>> commandsFor(final Path file) {
        if (os.contains("win")) {
            return List.of(List.of("explorer", "/select," + file));
        }
        if (os.contains("mac")) {
            return List.of(List.of("open", "-R", file.toString()));
        }
        final Path parent = file.getParent() != null ? file.getParent() : file;
        return LINUX_OPENERS.stream()
                .map(opener -> List.of(opener, parent.toString()))
                .toList();
    }
}
