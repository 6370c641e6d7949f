package dumb.polar.fold;

import dumb.polar.Lst;
import dumb.polar.Symbol;
import dumb.polar.Term;
import dumb.polar.Variable;

import java.util.ArrayList;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Replaces bound variables with their bindings. Unbound variables are left alone.
 * Bindings are applied once; a binding that mentions another bound variable is not chased.
 */
public class Substitution implements Folder {
    private final Map<Symbol, Term> bindings;

    public Substitution(Map<Symbol, Term> bindings) {
        this.bindings = Map.copyOf(requireNonNull(bindings));
    }

    public static Term apply(Term term, Map<Symbol, Term> bindings) {
        return bindings.isEmpty() ? term : new Substitution(bindings).foldTerm(term);
    }

    @Override
    public Term foldTerm(Term t) {
        if (t.value() instanceof Variable v) {
            var bound = bindings.get(v.name());
            // keep where the variable was written, take what it is bound to
            if (bound != null) return t.withValue(bound.value());
        }
        return Folder.super.foldTerm(t);
    }

    /**
     * A rest variable bound to a list is spliced into the enclosing list; one bound to
     * another variable is renamed to it.
     */
    @Override
    public Lst foldList(Lst l) {
        var folded = Fold.list(l, this);
        var rest = folded.restVar();
        if (rest == null) return folded;
        var bound = bindings.get(rest.name());
        if (bound == null) return folded;
        if (bound.value() instanceof Variable v) return new Lst(folded.elements(), v);
        if (!(bound.value() instanceof Lst tail)) return folded;
        var elements = new ArrayList<>(folded.elements());
        elements.addAll(tail.elements());
        return new Lst(elements, tail.restVar());
    }
}
