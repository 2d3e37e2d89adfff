package org.fmtguard.ir;

import org.fmtguard.lexer.Span;

import java.util.List;

/**
 * Literal text chunks separated by values: {@code chunk value chunk value ... last}.
 * <p>
 * Used both for a whole file, where the values are call sites, and for a single format string,
 * where the values are formatted arguments.
 *
 * @param <T> the type of the separating values
 */
public final class Interpolation<T> {

    /**
     * A literal chunk followed by the value that ends it.
     */
    public record Entry<T>(Span chunk, T value) {
    }

    private final List<Entry<T>> entries;
    private final Span last;

    public Interpolation(List<Entry<T>> entries, Span last) {
        this.entries = List.copyOf(entries);
        this.last = last;
    }

    public List<Entry<T>> entries() {
        return entries;
    }

    /**
     * The chunk after the last value.
     */
    public Span last() {
        return last;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "Interpolation{entries=" + entries + ", last=" + last + "}";
    }
}
