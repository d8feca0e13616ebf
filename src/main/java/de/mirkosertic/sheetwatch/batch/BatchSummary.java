package de.mirkosertic.sheetwatch.batch;

/**
 * Result of one batch baseline build.
 *
 * @param succeeded baselines created or replaced
 * @param skipped   files whose baseline was already up to date
 * @param failed    files that could not be read or saved
 * @param halted    true if the run stopped early (memory or stop request) and progress was saved
 */
public record BatchSummary(int succeeded, int skipped, int failed, boolean halted) {

    public int processed() {
        return succeeded + skipped + failed;
    }
}
