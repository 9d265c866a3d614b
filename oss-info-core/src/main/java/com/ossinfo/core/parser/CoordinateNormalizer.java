package com.ossinfo.core.parser;

import com.ossinfo.core.model.Coordinate;

import java.util.Set;

/**
 * Reduces a raw dependency token, as Gradle prints it, to a canonical coordinate.
 *
 * <p><b>Recognized shapes:</b>
 * <ul>
 *   <li>{@code org.jetbrains.kotlin:kotlin-stdlib-jdk8:1.6.21}</li>
 *   <li>{@code org.jetbrains.kotlin:kotlin-stdlib:1.6.21 -> 1.7.10}</li>
 *   <li>{@code org.jetbrains.kotlin:kotlin-stdlib:1.6.21 -> 1.7.10 (*)}</li>
 *   <li>{@code androidx.profileinstaller:profileinstaller:1.3.0 (*)}</li>
 *   <li>{@code androidx.compose.ui:ui-tooling -> 1.3.3} (version supplied by a BOM)</li>
 *   <li>{@code androidx.compose.material:material -> 1.3.1 (*)}</li>
 * </ul>
 * A trailing {@code (c)}, {@code (n)} or {@code FAILED} is accepted wherever {@code (*)} is.
 *
 * <p>The normalizer is stateless and does not know where in a tree the token came from.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Coordinate coordinate = CoordinateNormalizer.normalize("foo:bar:1.0 -> 2.0 (*)");
 * coordinate.toString(); // "foo:bar:2.0"
 * }</pre>
 */
public final class CoordinateNormalizer {

    private static final String SEGMENT_SEPARATOR = ":";
    private static final String TOKEN_SEPARATOR = " ";
    private static final String ARROW = "->";

    /** Suffixes Gradle appends after a version: omitted subtree, constraint, not resolved, resolution failed. */
    private static final Set<String> MARKERS = Set.of("(*)", "(c)", "(n)", "FAILED");

    /**
     * Layout of the colon separated segments.
     */
    enum CoordinateShape {
        /** {@code group:artifact:versionExpression} */
        DECLARED_VERSION,
        /** {@code group:artifact -> version}, the version comes from a BOM or constraint */
        MANAGED_VERSION;

        static CoordinateShape of(String[] segments, String token) throws DependencyReportException {
            return switch (segments.length) {
                case 3 -> DECLARED_VERSION;
                case 2 -> MANAGED_VERSION;
                default -> throw DependencyReportException.malformed(token);
            };
        }
    }

    /**
     * Layout of a version expression, split on spaces.
     */
    enum VersionShape {
        /** {@code 1.0} */
        PLAIN,
        /** {@code 1.0 (*)} */
        MARKED,
        /** {@code 1.0 -> 2.0} */
        OVERRIDDEN,
        /** {@code 1.0 -> 2.0 (*)} */
        OVERRIDDEN_MARKED;

        static VersionShape of(String[] tokens, String token) throws DependencyReportException {
            VersionShape shape = switch (tokens.length) {
                case 1 -> PLAIN;
                case 2 -> MARKED;
                case 3 -> OVERRIDDEN;
                case 4 -> OVERRIDDEN_MARKED;
                default -> throw DependencyReportException.malformed(token);
            };
            if (!shape.matches(tokens)) {
                throw DependencyReportException.malformed(token);
            }
            return shape;
        }

        private boolean matches(String[] tokens) {
            return switch (this) {
                case PLAIN -> true;
                case MARKED -> MARKERS.contains(tokens[1]);
                case OVERRIDDEN -> ARROW.equals(tokens[1]);
                case OVERRIDDEN_MARKED -> ARROW.equals(tokens[1]) && MARKERS.contains(tokens[3]);
            };
        }

        String resolvedVersion(String[] tokens) {
            return switch (this) {
                case PLAIN, MARKED -> tokens[0];
                case OVERRIDDEN, OVERRIDDEN_MARKED -> tokens[2];
            };
        }
    }

    private CoordinateNormalizer() {
    }

    /**
     * Normalizes one dependency token.
     *
     * @param token dependency token without tree art or indentation
     * @return canonical coordinate carrying the resolved version
     * @throws DependencyReportException of kind {@code MALFORMED_COORDINATE} for an unrecognized shape
     */
    public static Coordinate normalize(String token) throws DependencyReportException {
        String trimmed = token.trim();
        String[] segments = trimmed.split(SEGMENT_SEPARATOR, -1);

        Coordinate coordinate = switch (CoordinateShape.of(segments, trimmed)) {
            case DECLARED_VERSION -> {
                String[] versionTokens = segments[2].split(TOKEN_SEPARATOR, -1);
                VersionShape shape = VersionShape.of(versionTokens, trimmed);
                yield new Coordinate(segments[0], segments[1], shape.resolvedVersion(versionTokens));
            }
            case MANAGED_VERSION -> managedCoordinate(segments, trimmed);
        };

        if (coordinate.groupId().isEmpty() || coordinate.artifactId().isEmpty() || coordinate.version().isEmpty()) {
            throw DependencyReportException.malformed(trimmed);
        }
        return coordinate;
    }

    /**
     * Normalizes one dependency token to its canonical string.
     *
     * @param token dependency token without tree art or indentation
     * @return {@code group:artifact:version}
     * @throws DependencyReportException of kind {@code MALFORMED_COORDINATE} for an unrecognized shape
     */
    public static String normalizeToString(String token) throws DependencyReportException {
        return normalize(token).toString();
    }

    // |0       |1 |2    |3  |
    // `material -> 1.3.1 (*)`
    private static Coordinate managedCoordinate(String[] segments, String token) throws DependencyReportException {
        String[] tokens = segments[1].split(TOKEN_SEPARATOR, -1);
        if (tokens.length < 3 || tokens.length > 4 || !ARROW.equals(tokens[1])) {
            throw DependencyReportException.malformed(token);
        }
        if (tokens.length == 4 && !MARKERS.contains(tokens[3])) {
            throw DependencyReportException.malformed(token);
        }
        return new Coordinate(segments[0], tokens[0], tokens[2]);
    }
}
