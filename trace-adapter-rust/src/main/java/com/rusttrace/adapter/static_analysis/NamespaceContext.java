package com.rusttrace.adapter.static_analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Dotted namespace path used to build qualified names, e.g. {@code main.parser.Lexer}.
 *
 * Either empty or a non-empty list of segments. {@link #combine} concatenates segment lists;
 * {@link #EMPTY} is its identity on both sides.
 */
public final class NamespaceContext {

    public static final NamespaceContext EMPTY = new NamespaceContext(Collections.emptyList());

    private final List<String> segments;

    private NamespaceContext(List<String> segments) {
        this.segments = segments;
    }

    /**
     * Splits {@code source} on '.'; the empty string yields {@link #EMPTY}.
     */
    public static NamespaceContext fromString(String source) {
        if (source.isEmpty()) {
            return EMPTY;
        }
        return new NamespaceContext(List.of(source.split("\\.", -1)));
    }

    public static NamespaceContext of(String... segments) {
        if (segments.length == 0) return EMPTY;
        return new NamespaceContext(List.copyOf(Arrays.asList(segments)));
    }

    /** Returns this context with {@code other} nested inside it. */
    public NamespaceContext combine(NamespaceContext other) {
        if (other.isEmpty()) return this;
        if (this.isEmpty()) return other;
        List<String> joined = new ArrayList<>(segments.size() + other.segments.size());
        joined.addAll(segments);
        joined.addAll(other.segments);
        return new NamespaceContext(Collections.unmodifiableList(joined));
    }

    /** Shorthand for {@code combine(fromString(segment))}. */
    public NamespaceContext combine(String source) {
        return combine(fromString(source));
    }

    /** Left-to-right combination of all contexts, {@link #EMPTY} for none. */
    public static NamespaceContext sum(Iterable<NamespaceContext> contexts) {
        NamespaceContext result = EMPTY;
        for (NamespaceContext c : contexts) {
            result = result.combine(c);
        }
        return result;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public List<String> segments() {
        return segments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamespaceContext)) return false;
        return segments.equals(((NamespaceContext) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    /** Segments joined by '.', the empty string for {@link #EMPTY}. */
    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
