package com.eainde.loganalyzer.report;

import java.nio.file.Path;

/**
 * An artifact could not be written. Nothing partial is left at {@link #getTarget()}.
 */
public class ReportWriteException extends RuntimeException {

    private final transient Path target;

    public ReportWriteException(Path target, Throwable cause) {
        super("Failed to write report artifact " + target, cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
