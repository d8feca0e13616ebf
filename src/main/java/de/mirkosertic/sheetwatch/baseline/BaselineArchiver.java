package de.mirkosertic.sheetwatch.baseline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Re-encodes baselines of files that have been inactive for a while into the high-compression archive codec.
 */
public class BaselineArchiver {

    private static final Logger logger = LoggerFactory.getLogger(BaselineArchiver.class);

    private final BaselineStore store;
    private final BaselineCodec archiveCodec;
    private final int archiveAfterDays;
    private final Clock clock;

    public BaselineArchiver(final BaselineStore store, final BaselineCodec archiveCodec, final int archiveAfterDays) {
        this(store, archiveCodec, archiveAfterDays, Clock.systemUTC());
    }

    BaselineArchiver(final BaselineStore store, final BaselineCodec archiveCodec, final int archiveAfterDays,
                     final Clock clock) {
        this.store = store;
        this.archiveCodec = archiveCodec;
        this.archiveAfterDays = archiveAfterDays;
        this.clock = clock;
    }

    /**
     * Archive every baseline whose artifact was last written before the cutoff.
     *
     * @return number of baselines migrated to the archive codec
     */
    public int archiveInactive() throws IOException {
        if (archiveAfterDays <= 0) {
            logger.debug("Baseline archiving disabled");
            return 0;
        }
        final Instant cutoff = clock.instant().minus(Duration.ofDays(archiveAfterDays));
        int archived = 0;
        for (final String key : store.keys()) {
            if (store.codecOf(key) == archiveCodec) {
                continue;
            }
            final Instant modified = store.lastModified(key);
            if (modified != null && modified.isBefore(cutoff) && store.migrate(key, archiveCodec)) {
                archived++;
            }
        }
        if (archived > 0) {
            logger.info("Archived {} inactive baselines with codec {}", archived, archiveCodec.codecName());
        }
        return archived;
    }
}
