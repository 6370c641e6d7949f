package dumb.polar;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Formal slot of a {@link Rule}. The optional specializer constrains which arguments the clause accepts.
 */
public record Parameter(Term parameter, @Nullable Term specializer) {
    public Parameter {
        requireNonNull(parameter);
    }

    public Parameter(Term parameter) {
        this(parameter, null);
    }

    @Override
    public String toString() {
        return specializer == null ? parameter.toString() : parameter + ": " + specializer;
    }
}
