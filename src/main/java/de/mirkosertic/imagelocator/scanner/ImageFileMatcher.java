package de.mirkosertic.imagelocator.scanner;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a walked path is an image file that should be indexed.
 * Extensions are compared case-insensitively; exclude globs are matched against the full path.
 */
public class ImageFileMatcher {

    private final Set<String> extensions;
    private final List<PathMatcher> excludeMatchers;

    public ImageFileMatcher(final Collection<String> extensions, final List<String> excludePatterns) {
        this.extensions = extensions.stream()
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.excludeMatchers = excludePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    public boolean shouldInclude(final Path file) {
        // Check if file matches any exclude pattern
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(file)) {
                return false;
            }
        }

        final Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        final String extension = extensionOf(fileName.toString());
        return extension != null && extensions.contains(extension);
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    private static String extensionOf(final String fileName) {
        final int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return null;
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
