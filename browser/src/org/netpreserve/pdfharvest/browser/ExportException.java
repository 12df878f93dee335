package org.netpreserve.pdfharvest.browser;

import java.nio.file.Path;

public class ExportException extends Exception {
    private final Path path;

    public ExportException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public ExportException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
