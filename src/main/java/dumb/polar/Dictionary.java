package dumb.polar;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Mapping from {@link Symbol} to {@link Term}, iterated in key order.
 * Two dictionaries holding the same pairs are equal however they were built.
 */
public record Dictionary(SortedMap<Symbol, Term> fields) implements Value {
    public static final Dictionary EMPTY = new Dictionary(Map.of());

    public Dictionary(Map<Symbol, Term> fields) {
        this(sorted(fields));
    }

    public Dictionary {
        fields = sorted(requireNonNull(fields));
    }

    static SortedMap<Symbol, Term> sorted(Map<Symbol, Term> fields) {
        return Collections.unmodifiableSortedMap(new TreeMap<>(fields));
    }

    public Term get(Symbol key) {
        return fields.get(key);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return fields.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
