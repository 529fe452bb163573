package org.pragmatica.markup.syntax.literal;

import java.util.Optional;

/**
 * Absolute length units accepted as numeric suffixes: {@code 12pt}, {@code 3cm}.
 */
public enum LengthUnit {
    PT("pt"),
    MM("mm"),
    CM("cm"),
    IN("in");

    private final String suffix;

    LengthUnit(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    public static Optional<LengthUnit> fromSuffix(String suffix) {
        for (var unit : values()) {
            if (unit.suffix.equals(suffix)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return suffix;
    }
}
