/**
 * Exception thrown when a persisted credential or cache file cannot be decoded
 *
 * @author William Callahan
 */

package com.williamcallahan.cinema_lookup.exception;

import java.nio.file.Path;

public class CorruptStateException extends LookupStageException {

    private final Path path;

    public CorruptStateException(Path path, String reason, Throwable cause) {
        super("Corrupt state file " + path + ": " + reason, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
