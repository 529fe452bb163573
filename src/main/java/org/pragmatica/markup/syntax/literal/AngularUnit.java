package org.pragmatica.markup.syntax.literal;

import java.util.Optional;

/**
 * Angle units accepted as numeric suffixes: {@code 1.5rad}, {@code 90deg}.
 */
public enum AngularUnit {
    RAD("rad"),
    DEG("deg");

    private final String suffix;

    AngularUnit(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    public static Optional<AngularUnit> fromSuffix(String suffix) {
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
