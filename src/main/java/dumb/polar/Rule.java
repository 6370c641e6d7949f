package dumb.polar;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * One clause, {@code name(params) if body}. A {@code required} rule must be satisfiable;
 * that is checked by validation outside this package.
 */
public record Rule(Symbol name, List<Parameter> params, Term body, SourceInfo source, boolean required) {
    public Rule {
        requireNonNull(name);
        params = List.copyOf(requireNonNull(params));
        requireNonNull(body);
        requireNonNull(source);
    }

    public Rule(Symbol name, List<Parameter> params, Term body) {
        this(name, params, body, SourceInfo.HOST, false);
    }

    public int arity() {
        return params.size();
    }

    @Override
    public String toString() {
        return name + params.stream().map(Parameter::toString).collect(Collectors.joining(", ", "(", ")"))
                + " if " + body + ";";
    }
}
