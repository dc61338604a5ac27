package io.github.cyfko.contactql.core.model;

/**
 * Declared value kind of a custom contact field.
 * <p>
 * Each type carries the single-character code used by stored field definitions and, for the
 * location types, the administrative boundary level its values are resolved against.
 * </p>
 *
 * @since 1.0.0
 */
public enum ValueType {
    TEXT('T', -1),
    DECIMAL('N', -1),
    DATETIME('D', -1),
    STATE('S', 1),
    DISTRICT('I', 2),
    WARD('W', 3);

    private final char code;
    private final int boundaryLevel;

    ValueType(char code, int boundaryLevel) {
        this.code = code;
        this.boundaryLevel = boundaryLevel;
    }

    public char code() {
        return code;
    }

    /**
     * @return the boundary level (1 state, 2 district, 3 ward), or -1 for non-location types
     */
    public int boundaryLevel() {
        return boundaryLevel;
    }

    public boolean isLocation() {
        return boundaryLevel > 0;
    }

    /**
     * Looks up a value type by its stored code.
     *
     * @param code one of {@code T N D S I W}
     * @return the matching value type
     * @throws IllegalArgumentException if the code is unknown
     */
    public static ValueType fromCode(char code) {
        for (ValueType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unrecognized contact field type '" + code + "'");
    }
}
