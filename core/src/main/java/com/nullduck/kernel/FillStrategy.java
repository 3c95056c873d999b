package com.nullduck.kernel;

import java.util.Locale;

/**
 * Direction of a strategy-based null fill.
 *
 * <ul>
 *   <li>{@code FORWARD}: each null takes the nearest valid value to its left</li>
 *   <li>{@code BACKWARD}: each null takes the nearest valid value to its right</li>
 * </ul>
 *
 * <p>A null with no valid value in the scan direction stays null; there is no
 * fallback to the opposite direction.
 */
public enum FillStrategy {
    FORWARD("forward"),
    BACKWARD("backward");

    private final String literal;

    FillStrategy(String literal) {
        this.literal = literal;
    }

    /**
     * Returns the literal accepted by {@link #parse(String)}.
     *
     * @return "forward" or "backward"
     */
    public String literal() {
        return literal;
    }

    /**
     * Parse a strategy literal (case-insensitive).
     *
     * @param value "forward" or "backward"
     * @return the parsed strategy
     * @throws IllegalArgumentException if value is not recognized
     */
    public static FillStrategy parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("fill strategy must not be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "forward"  -> FORWARD;
            case "backward" -> BACKWARD;
            default -> throw new IllegalArgumentException(
                "Unknown fill strategy: '%s'. Valid values: forward, backward".formatted(value));
        };
    }

    @Override
    public String toString() {
        return literal;
    }
}
