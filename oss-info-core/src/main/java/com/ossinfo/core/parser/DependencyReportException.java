package com.ossinfo.core.parser;

import java.util.Objects;

/**
 * Fatal failure while turning a dependency report into a coordinate list.
 *
 * <p>Every failure aborts the whole parse; callers must treat it as "nothing was produced
 * for this input". The {@link Kind} tells which rule of the report format was broken.
 */
public class DependencyReportException extends Exception {

    /**
     * Category of a report failure.
     */
    public enum Kind {
        /** Indentation is not a multiple of the tree unit, or a nested line precedes the root. */
        INDENTATION,
        /** Trees of several configurations were concatenated without a configuration filter. */
        MISSING_CONFIGURATION,
        /** A dependency token does not have one of the recognized shapes. */
        MALFORMED_COORDINATE,
        /** The underlying reader failed. */
        IO
    }

    private final Kind kind;

    public DependencyReportException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public DependencyReportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Returns the category of this failure.
     *
     * @return failure kind
     */
    public Kind kind() {
        return kind;
    }

    static DependencyReportException indentation(String message) {
        return new DependencyReportException(Kind.INDENTATION, message);
    }

    static DependencyReportException malformed(String token) {
        return new DependencyReportException(Kind.MALFORMED_COORDINATE, "Unexpected dependency format: " + token);
    }
}
