package org.pragmatica.markup.syntax;

import org.pragmatica.markup.tree.SourceSpan;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The ordered arguments of a call: {@code 12, draw: false}.
 *
 * <p>For a bracketed call with a body, the span excludes the body so that diagnostics
 * point at the bracket only.
 */
public record Args(SourceSpan span, List<Argument> items) {
    public Args {
        Objects.requireNonNull(span, "span");
        items = List.copyOf(items);
    }

    public static Args of(Argument... items) {
        return new Args(SourceSpan.DETACHED, List.of(items));
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Optional<Argument> last() {
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(items.size() - 1));
    }

    /**
     * All arguments but the last.
     */
    public List<Argument> head() {
        return items.isEmpty() ? List.of() : items.subList(0, items.size() - 1);
    }
}
