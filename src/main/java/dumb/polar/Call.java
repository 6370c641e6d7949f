package dumb.polar;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Predicate or method call: a name, positional arguments and optional keyword arguments.
 */
public record Call(Symbol name, List<Term> args, @Nullable SortedMap<Symbol, Term> kwargs) implements Value {
    public Call {
        requireNonNull(name);
        args = List.copyOf(requireNonNull(args));
        if (kwargs != null) kwargs = Dictionary.sorted(kwargs);
    }

    public Call(Symbol name, List<Term> args, @Nullable Map<Symbol, Term> kwargs) {
        this(name, args, kwargs == null ? null : Dictionary.sorted(kwargs));
    }

    public Call(Symbol name, List<Term> args) {
        this(name, args, (SortedMap<Symbol, Term>) null);
    }

    public static Call of(String name, Term... args) {
        return new Call(Symbol.of(name), List.of(args));
    }

    @Override
    public String toString() {
        var kw = kwargs == null ? Stream.<String>empty()
                : kwargs.entrySet().stream().map(e -> e.getKey() + ": " + e.getValue());
        return name + Stream.concat(args.stream().map(Term::toString), kw)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
