package org.pragmatica.markup.pretty;

/**
 * Printer configuration options.
 *
 * @param maxDepth deepest expression nesting the printer accepts; deeper trees are rejected
 *                 before printing starts
 */
public record PrinterConfig(int maxDepth) {
    public static final PrinterConfig DEFAULT = new PrinterConfig(512);

    public PrinterConfig {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
    }

    public PrinterConfig withMaxDepth(int maxDepth) {
        return new PrinterConfig(maxDepth);
    }
}
