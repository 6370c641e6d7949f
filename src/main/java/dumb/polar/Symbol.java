package dumb.polar;

import static java.util.Objects.requireNonNull;

/**
 * Identifier used for variable names, rule names, class tags and dictionary keys.
 * Ordered lexicographically by its text. Equality is by text; symbols are not interned.
 */
public record Symbol(String name) implements Comparable<Symbol> {

    public Symbol {
        requireNonNull(name);
        if (name.isEmpty())
            throw new IllegalArgumentException("Symbol name must not be empty");
    }

    public static Symbol of(String name) {
        return new Symbol(name);
    }

    @Override
    public int compareTo(Symbol o) {
        return name.compareTo(o.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
