package org.pragmatica.markup.syntax.literal;

import java.util.Objects;

/**
 * The kinds of literal values, each with exactly one canonical source form.
 *
 * <p>Floating-point kinds reject NaN and infinities on construction, so every
 * constructed literal has a printable canonical form.
 */
public sealed interface LitKind {

    None NONE = new None();

    /**
     * Canonical source text of this literal.
     */
    String canonical();

    static Bool bool(boolean value) {
        return new Bool(value);
    }

    static Int integer(long value) {
        return new Int(value);
    }

    static Float floating(double value) {
        return new Float(value);
    }

    static Length length(double value, LengthUnit unit) {
        return new Length(value, unit);
    }

    static Angle angle(double value, AngularUnit unit) {
        return new Angle(value, unit);
    }

    static Percent percent(double value) {
        return new Percent(value);
    }

    static Color color(RgbaColor color) {
        return new Color(color);
    }

    static Str string(String value) {
        return new Str(value);
    }

    /**
     * The none literal: {@code none}.
     */
    record None() implements LitKind {
        @Override
        public String canonical() {
            return "none";
        }
    }

    /**
     * {@code true}, {@code false}.
     */
    record Bool(boolean value) implements LitKind {
        @Override
        public String canonical() {
            return Boolean.toString(value);
        }
    }

    /**
     * A 64-bit integer: {@code 120}.
     */
    record Int(long value) implements LitKind {
        @Override
        public String canonical() {
            return Long.toString(value);
        }
    }

    /**
     * A floating-point number: {@code 1.2}, {@code 1e-4}.
     */
    record Float(double value) implements LitKind {
        public Float {
            Decimals.requireFinite(value);
        }

        @Override
        public String canonical() {
            return Decimals.format(value);
        }
    }

    /**
     * A length: {@code 12pt}, {@code 3cm}.
     */
    record Length(double value, LengthUnit unit) implements LitKind {
        public Length {
            Decimals.requireFinite(value);
            Objects.requireNonNull(unit, "unit");
        }

        @Override
        public String canonical() {
            return Decimals.format(value) + unit.suffix();
        }
    }

    /**
     * An angle: {@code 1.5rad}, {@code 90deg}.
     */
    record Angle(double value, AngularUnit unit) implements LitKind {
        public Angle {
            Decimals.requireFinite(value);
            Objects.requireNonNull(unit, "unit");
        }

        @Override
        public String canonical() {
            return Decimals.format(value) + unit.suffix();
        }
    }

    /**
     * A percentage: {@code 50%}.
     *
     * <p>The value is kept in percent units: {@code 50%} is stored as {@code 50.0},
     * not as the {@code 0.5} ratio a runtime value would hold.
     */
    record Percent(double value) implements LitKind {
        public Percent {
            Decimals.requireFinite(value);
        }

        public double ratio() {
            return value / 100.0;
        }

        @Override
        public String canonical() {
            return Decimals.format(value) + "%";
        }
    }

    /**
     * A color: {@code #ffccee}.
     */
    record Color(RgbaColor color) implements LitKind {
        public Color {
            Objects.requireNonNull(color, "color");
        }

        @Override
        public String canonical() {
            return color.toHex();
        }
    }

    /**
     * A string: {@code "hello!"}. Holds the unescaped text.
     */
    record Str(String value) implements LitKind {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        /**
         * Quoted text with only {@code "} and {@code \} escaped.
         */
        @Override
        public String canonical() {
            var sb = new StringBuilder(value.length() + 2).append('"');
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                if (c == '"' || c == '\\') {
                    sb.append('\\');
                }
                sb.append(c);
            }
            return sb.append('"').toString();
        }
    }
}
