package org.pragmatica.markup.syntax.literal;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Shortest round-trip decimal text for finite doubles.
 *
 * <p>Values whose leading digit sits at a decimal exponent in [-5, 16) print in plain
 * notation ({@code 3.14}, {@code 0.00001}); integral values keep a trailing {@code .0}.
 * Everything else prints in scientific notation without a redundant mantissa fraction
 * ({@code 1e21}, {@code 1.5e-7}).
 */
public final class Decimals {
    private static final int MIN_PLAIN_EXPONENT = -5;
    private static final int MAX_PLAIN_EXPONENT = 16;
    private static final int MAX_SIGNIFICANT_DIGITS = 17;

    private Decimals() {}

    public static String format(double value) {
        requireFinite(value);
        if (value == 0.0) {
            return Double.doubleToRawLongBits(value) < 0 ? "-0.0" : "0.0";
        }
        var decimal = shortest(value).stripTrailingZeros();
        var digits = decimal.unscaledValue()
                            .abs()
                            .toString();
        int exponent = digits.length() - 1 - decimal.scale();

        var sb = new StringBuilder(digits.length() + 8);
        if (decimal.signum() < 0) {
            sb.append('-');
        }
        if (exponent >= MIN_PLAIN_EXPONENT && exponent < MAX_PLAIN_EXPONENT) {
            appendPlain(sb, digits, exponent);
        } else {
            appendScientific(sb, digits, exponent);
        }
        return sb.toString();
    }

    /**
     * Fails with {@link IllegalArgumentException} for NaN and infinities.
     */
    public static double requireFinite(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Numeric literal must be finite, got " + value);
        }
        return value;
    }

    /**
     * Fewest significant digits that parse back to {@code value}. Among candidates of that
     * length the one nearest the exact binary value wins.
     */
    static BigDecimal shortest(double value) {
        var exact = new BigDecimal(value);
        for (int precision = 1; precision < MAX_SIGNIFICANT_DIGITS; precision++) {
            var nearest = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (Double.parseDouble(nearest.toString()) == value) {
                return nearest;
            }
            // The rounding interval is lopsided at powers of two; the neighbour on the far side may still fit.
            var other = exact.round(new MathContext(precision, nearest.abs().compareTo(exact.abs()) > 0
                                                               ? RoundingMode.DOWN
                                                               : RoundingMode.UP));
            if (Double.parseDouble(other.toString()) == value) {
                return other;
            }
        }
        return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN));
    }

    private static void appendPlain(StringBuilder sb, String digits, int exponent) {
        if (exponent < 0) {
            sb.append("0.");
            sb.append("0".repeat(-exponent - 1));
            sb.append(digits);
            return;
        }
        int integerDigits = exponent + 1;
        if (digits.length() <= integerDigits) {
            sb.append(digits);
            sb.append("0".repeat(integerDigits - digits.length()));
            sb.append(".0");
        } else {
            sb.append(digits, 0, integerDigits);
            sb.append('.');
            sb.append(digits, integerDigits, digits.length());
        }
    }

    private static void appendScientific(StringBuilder sb, String digits, int exponent) {
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.');
            sb.append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent);
    }
}
