package de.mirkosertic.sheetwatch.watch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Files whose first event in a session takes a fresh baseline instead of being compared.
 * <p>
 * An entry matches when it occurs, case-insensitively, anywhere in the file's path; a bare file name
 * therefore matches that file in every watched folder. Each path is claimed at most once per session.
 */
public class ForcedBaselineList {

    private final List<String> patterns;
    private final Set<Path> seen = ConcurrentHashMap.newKeySet();

    public ForcedBaselineList(final Collection<String> patterns) {
        final List<String> normalized = new ArrayList<>();
        for (final String pattern : patterns) {
            if (pattern != null && !pattern.isBlank()) {
                normalized.add(pattern.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.patterns = List.copyOf(normalized);
    }

    public boolean matches(final Path file) {
        final String path = file.toString().toLowerCase(Locale.ROOT);
        for (final String pattern : patterns) {
            if (path.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True exactly once per path, for listed files that have not been seen in this session.
     */
    public boolean claimFirstSight(final Path file) {
        return matches(file) && seen.add(normalize(file));
    }

    /**
     * Record that {@code file} already has a baseline taken in this session.
     */
    public void markSeen(final Path file) {
        if (matches(file)) {
            seen.add(normalize(file));
        }
    }

    private static Path normalize(final Path file) {
        return file.toAbsolutePath().normalize();
    }
}
