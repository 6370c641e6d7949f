package dumb.polar.fold;

import dumb.polar.Rule;
import dumb.polar.Symbol;
import dumb.polar.Term;
import dumb.polar.Variable;
import dumb.polar.kb.KnowledgeBase;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Renames every variable to a fresh gensym, so a rule clause can be resolved without
 * capturing the caller's variables. A name maps to the same fresh name for the life of
 * the renamer; use one renamer per clause.
 */
public class Renamer implements Folder {
    private final KnowledgeBase kb;
    private final Map<Symbol, Variable> renames = new HashMap<>();

    public Renamer(KnowledgeBase kb) {
        this.kb = requireNonNull(kb);
    }

    public static Rule rename(Rule rule, KnowledgeBase kb) {
        return new Renamer(kb).foldRule(rule);
    }

    public static Term rename(Term term, KnowledgeBase kb) {
        return new Renamer(kb).foldTerm(term);
    }

    @Override
    public Variable foldVariable(Variable v) {
        return renames.computeIfAbsent(v.name(), n -> new Variable(kb.gensym(n.name())));
    }

    /** Original name to fresh variable, for everything renamed so far. */
    public Map<Symbol, Variable> renames() {
        return Collections.unmodifiableMap(renames);
    }
}
