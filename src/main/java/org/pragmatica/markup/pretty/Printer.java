package org.pragmatica.markup.pretty;

import java.util.List;
import java.util.function.Consumer;

/**
 * Append-only text buffer used by the canonical printer.
 */
public final class Printer {
    private static final int DEFAULT_CAPACITY = 64;

    private final StringBuilder sb = new StringBuilder(DEFAULT_CAPACITY);

    public Printer push(char c) {
        sb.append(c);
        return this;
    }

    public Printer push(String text) {
        sb.append(text);
        return this;
    }

    /**
     * Write each item with {@code writer}, separated by {@code separator}.
     */
    public <T> Printer join(List<? extends T> items, String separator, Consumer<? super T> writer) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            writer.accept(items.get(i));
        }
        return this;
    }

    public String finish() {
        return sb.toString();
    }
}
