package dumb.polar;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * List of terms. A non-null {@code restVar} matches the tail, as in {@code [x, y, *rest]}.
 */
public record Lst(List<Term> elements, @Nullable Variable restVar) implements Value {
    public Lst {
        elements = List.copyOf(requireNonNull(elements));
    }

    public Lst(List<Term> elements) {
        this(elements, null);
    }

    public static Lst of(Term... elements) {
        return new Lst(List.of(elements));
    }

    public boolean hasRest() {
        return restVar != null;
    }

    @Override
    public String toString() {
        var s = elements.stream().map(Term::toString).collect(Collectors.joining(", "));
        if (restVar != null) s = s.isEmpty() ? "*" + restVar : s + ", *" + restVar;
        return "[" + s + "]";
    }
}
