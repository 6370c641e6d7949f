package dumb.polar;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** N-ary expression: connectives, arithmetic, comparisons and control forms alike. */
public record Operation(Operator operator, List<Term> args) implements Value {
    public Operation {
        requireNonNull(operator);
        args = List.copyOf(requireNonNull(args));
    }

    public static Operation of(Operator operator, Term... args) {
        return new Operation(operator, List.of(args));
    }

    @Override
    public String toString() {
        return args.stream().map(Term::toString)
                .collect(Collectors.joining(" " + operator.symbol() + " ", "(", ")"));
    }
}
