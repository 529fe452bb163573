package org.pragmatica.markup.syntax;

/**
 * Exhaustive dispatch over {@link Node} variants.
 */
public interface NodeVisitor<R> {
    R visitText(Node.Text text);

    R visitSpace(Node.Space space);

    R visitLinebreak(Node.Linebreak linebreak);

    R visitParbreak(Node.Parbreak parbreak);

    R visitStrong(Node.Strong strong);

    R visitEmph(Node.Emph emph);

    R visitEmbedded(Node.Embedded embedded);
}
