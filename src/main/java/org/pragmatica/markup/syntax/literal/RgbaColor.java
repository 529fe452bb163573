package org.pragmatica.markup.syntax.literal;

/**
 * An 8-bit-per-channel RGBA color.
 *
 * <p>Opaque colors print as {@code #rrggbb}; any other alpha prints as {@code #rrggbbaa}.
 */
public record RgbaColor(int r, int g, int b, int a) {
    private static final String HEX_DIGITS = "0123456789abcdef";

    public RgbaColor {
        checkChannel("r", r);
        checkChannel("g", g);
        checkChannel("b", b);
        checkChannel("a", a);
    }

    public static RgbaColor rgb(int r, int g, int b) {
        return new RgbaColor(r, g, b, 0xff);
    }

    /**
     * Parse {@code rgb}, {@code rgba}, {@code rrggbb} or {@code rrggbbaa} hex text,
     * with or without a leading {@code #}.
     */
    public static RgbaColor fromHex(String text) {
        var hex = text.startsWith("#") ? text.substring(1) : text;
        int len = hex.length();
        if (len != 3 && len != 4 && len != 6 && len != 8) {
            throw new IllegalArgumentException("Color must have 3, 4, 6 or 8 hex digits: " + text);
        }
        boolean shortForm = len <= 4;
        int step = shortForm ? 1 : 2;
        var channels = new int[] {0, 0, 0, 0xff};
        for (int i = 0, channel = 0; i < len; i += step, channel++) {
            int value = 0;
            for (int j = i; j < i + step; j++) {
                int digit = Character.digit(hex.charAt(j), 16);
                if (digit < 0) {
                    throw new IllegalArgumentException("Invalid hex digit '" + hex.charAt(j) + "' in color " + text);
                }
                value = value * 16 + digit;
            }
            channels[channel] = shortForm ? value * 17 : value;
        }
        return new RgbaColor(channels[0], channels[1], channels[2], channels[3]);
    }

    public boolean isOpaque() {
        return a == 0xff;
    }

    public String toHex() {
        var sb = new StringBuilder(9).append('#');
        appendHex(sb, r);
        appendHex(sb, g);
        appendHex(sb, b);
        if (!isOpaque()) {
            appendHex(sb, a);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toHex();
    }

    private static void appendHex(StringBuilder sb, int value) {
        sb.append(HEX_DIGITS.charAt(value >> 4))
          .append(HEX_DIGITS.charAt(value & 0xf));
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 0xff) {
            throw new IllegalArgumentException("Color channel " + name + " out of range: " + value);
        }
    }
}
