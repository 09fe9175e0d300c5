package com.umls.sync.graph;

/**
 * Validation of identifiers that are spliced into Cypher text rather than passed as values:
 * relationship types and labels are backtick-quoted, so they must not contain a backtick.
 */
public final class InputSanitizer {

    /** Maximum allowed length for a version tag. */
    public static final int MAX_VERSION_LENGTH = 64;

    private static final String IDENTIFIER = "^[A-Za-z0-9_:\\-]+$";

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a relationship type such as {@code biolink:treats} or {@code HAS_CODE}.
     *
     * @throws IllegalArgumentException if the type is invalid
     */
    public static void validateRelationshipType(String relationshipType) {
        if (relationshipType == null || relationshipType.isBlank()) {
            throw new IllegalArgumentException("Relationship type must not be null or blank");
        }
        if (!relationshipType.matches(IDENTIFIER)) {
            throw new IllegalArgumentException(
                    "Relationship type must contain only alphanumerics, '_', ':' or '-', " +
                            "got: '" + relationshipType + "'");
        }
    }

    /**
     * Validates a node label such as {@code biolink:Disease}.
     */
    public static void validateLabel(String label) {
        if (label == null || label.isBlank() || !label.matches(IDENTIFIER)) {
            throw new IllegalArgumentException("Invalid node label: '" + label + "'");
        }
    }

    /**
     * Validates a release version tag.
     */
    public static void validateVersion(String version) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Version must not be null or blank");
        }
        if (version.length() > MAX_VERSION_LENGTH) {
            throw new IllegalArgumentException(
                    "Version exceeds maximum length of " + MAX_VERSION_LENGTH +
                            " characters (was " + version.length() + ")");
        }
        if (containsControlCharacters(version)) {
            throw new IllegalArgumentException("Version must not contain control characters");
        }
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F).
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
