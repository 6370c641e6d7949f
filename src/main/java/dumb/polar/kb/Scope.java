package dumb.polar.kb;

import dumb.polar.Symbol;
import dumb.polar.Term;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/** Named namespace of constants and rule groups. */
public final class Scope {
    private final Path name;
    final Map<Symbol, Term> constants = new HashMap<>();
    final Map<Symbol, GenericRule> rules = new HashMap<>();

    Scope(Path name) {
        this.name = requireNonNull(name);
    }

    public Path name() {
        return name;
    }

    public Map<Symbol, Term> constants() {
        return Collections.unmodifiableMap(constants);
    }

    public Map<Symbol, GenericRule> rules() {
        return Collections.unmodifiableMap(rules);
    }

    @Override
    public String toString() {
        return "Scope[" + name + ", " + constants.size() + " constants, " + rules.size() + " rules]";
    }
}
