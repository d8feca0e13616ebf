package de.mirkosertic.sheetwatch.detect;

import de.mirkosertic.sheetwatch.config.ApplicationConfig;
import de.mirkosertic.sheetwatch.model.CellChange;
import de.mirkosertic.sheetwatch.model.ChangeKind;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides which change kinds are reported to the audit sink and count as activity for polling, and whether
 * edits by whitelisted users are recorded at all. Non-reportable changes are still written into the baseline.
 */
public class ChangeFilterPolicy {

    private final Set<ChangeKind> reportable;
    private final Set<String> whitelistedUsers;
    private final boolean recordWhitelistedChanges;

    public ChangeFilterPolicy(final Set<ChangeKind> reportable) {
        this(reportable, Set.of(), true);
    }

    private ChangeFilterPolicy(final Set<ChangeKind> reportable, final Set<String> whitelistedUsers,
                               final boolean recordWhitelistedChanges) {
        this.reportable = reportable.isEmpty() ? EnumSet.noneOf(ChangeKind.class) : EnumSet.copyOf(reportable);
        this.whitelistedUsers = whitelistedUsers;
        this.recordWhitelistedChanges = recordWhitelistedChanges;
    }

    public static ChangeFilterPolicy fromConfig(final ApplicationConfig config) {
        final ChangeFilterPolicy kinds = config.isReportIndirectChanges() ? reportAll() : excludingIndirect();
        return kinds.withWhitelist(config.getWhitelistUsers(), config.isLogWhitelistUserChanges());
    }

    /**
     * Same kinds, with the given user names whitelisted. Names compare case-insensitively. If
     * {@code recordChanges} is false, edits whose author is whitelisted are not written to the audit trail.
     */
    public ChangeFilterPolicy withWhitelist(final Collection<String> users, final boolean recordChanges) {
        final Set<String> normalized = new HashSet<>();
        for (final String user : users) {
            if (user != null && !user.isBlank()) {
                normalized.add(user.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new ChangeFilterPolicy(reportable, Set.copyOf(normalized), recordChanges);
    }

    public static ChangeFilterPolicy reportAll() {
        return new ChangeFilterPolicy(EnumSet.allOf(ChangeKind.class));
    }

    /**
     * Everything except recalculation results of unchanged formulas.
     */
    public static ChangeFilterPolicy excludingIndirect() {
        return new ChangeFilterPolicy(EnumSet.complementOf(EnumSet.of(ChangeKind.INDIRECT_CHANGED)));
    }

    public boolean isReportable(final ChangeKind kind) {
        return reportable.contains(kind);
    }

    public boolean isWhitelisted(final @Nullable String author) {
        return author != null && whitelistedUsers.contains(author.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * True if edits by {@code author} are kept out of the audit trail.
     */
    public boolean suppresses(final @Nullable String author) {
        return !recordWhitelistedChanges && isWhitelisted(author);
    }

    public List<CellChange> reportableOf(final List<CellChange> changes) {
        final List<CellChange> result = new ArrayList<>(changes.size());
        for (final CellChange change : changes) {
            if (isReportable(change.kind())) {
                result.add(change);
            }
        }
        return result;
    }
}
