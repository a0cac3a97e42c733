package com.vaultsearch.vectors;

import java.io.IOException;
import java.nio.file.Path;

public class MalformedRecordException extends IOException {
    private final Path file;

    public MalformedRecordException(Path file, String reason) {
        super(file + ": " + reason);
        this.file = file;
    }

    public MalformedRecordException(Path file, Throwable cause) {
        super(file + ": " + cause.getMessage(), cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
