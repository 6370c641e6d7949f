package dumb.polar.kb;

import dumb.polar.Symbol;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Dotted name such as {@code authz.allow}. A one-segment path names something in the
 * current scope; a longer one is qualified by the scope named in its first segment.
 */
public record Path(List<Symbol> segments) {
    public static final Path DEFAULT = Path.of(KnowledgeBase.DEFAULT_SCOPE);

    public Path {
        segments = List.copyOf(requireNonNull(segments));
        if (segments.isEmpty()) throw new IllegalArgumentException("Path must have at least one segment");
    }

    public static Path of(String dotted) {
        requireNonNull(dotted);
        var parts = dotted.split("\\.", -1);
        for (var p : parts)
            if (p.isEmpty()) throw new IllegalArgumentException("Empty segment in path: '" + dotted + "'");
        return new Path(Arrays.stream(parts).map(Symbol::of).toList());
    }

    public static Path of(Symbol name) {
        return new Path(List.of(name));
    }

    /** First segment. */
    public Symbol first() {
        return segments.get(0);
    }

    public Resolved resolve() {
        if (segments.size() == 1) return new Local(first());
        var rest = segments.subList(1, segments.size()).stream().map(Symbol::name).collect(Collectors.joining("."));
        return new Qualified(first(), Symbol.of(rest));
    }

    @Override
    public String toString() {
        return segments.stream().map(Symbol::name).collect(Collectors.joining("."));
    }

    public sealed interface Resolved permits Local, Qualified {
        Symbol name();
    }

    public record Local(Symbol name) implements Resolved {
    }

    public record Qualified(Symbol scope, Symbol name) implements Resolved {
    }
}
