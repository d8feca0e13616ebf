package de.mirkosertic.sheetwatch.watch;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Accepts spreadsheet files by extension and rejects the lock files office applications create next to
 * an open workbook ({@code ~$Book.xlsx}). Matching is case-insensitive.
 */
public class FilePatternMatcher {

    private final List<PathMatcher> includeMatchers;
    private final List<PathMatcher> excludeMatchers;

    public FilePatternMatcher(final List<String> extensions, final List<String> lockFilePrefixes) {
        this.includeMatchers = extensions.stream()
                .map(ext -> ext.startsWith(".") ? ext : "." + ext)
                .map(ext -> FileSystems.getDefault().getPathMatcher("glob:*" + globEscape(ext.toLowerCase(Locale.ROOT))))
                .toList();
        this.excludeMatchers = lockFilePrefixes.stream()
                .map(prefix -> FileSystems.getDefault().getPathMatcher("glob:" + globEscape(prefix.toLowerCase(Locale.ROOT)) + "*"))
                .toList();
    }

    public boolean shouldInclude(final Path file) {
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        final Path name = Paths.get(fileName.toString().toLowerCase(Locale.ROOT));

        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(name)) {
                return false;
            }
        }

        for (final PathMatcher includeMatcher : includeMatchers) {
            if (includeMatcher.matches(name)) {
                return true;
            }
        }

        return false;
    }

    private static String globEscape(final String literal) {
        final StringBuilder escaped = new StringBuilder(literal.length());
        for (final char c : literal.toCharArray()) {
            if ("\\*?[]{}".indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
