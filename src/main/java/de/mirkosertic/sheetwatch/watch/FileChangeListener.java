package de.mirkosertic.sheetwatch.watch;

import java.nio.file.Path;

public interface FileChangeListener {

    void onFileCreated(Path file);

    void onFileModified(Path file);

    void onFileDeleted(Path file);

    /**
     * A file disappeared and another appeared in the same batch of directory events.
     */
    void onFileMoved(Path from, Path to);
}
