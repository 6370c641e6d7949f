package dumb.polar.kb;

import dumb.polar.Rule;
import dumb.polar.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * All clauses sharing one rule name, in the order they were added. Which clause applies
 * to a query is decided by the query engine.
 */
public final class GenericRule {
    private final Symbol name;
    private final List<Rule> rules = new ArrayList<>();

    public GenericRule(Symbol name) {
        this.name = requireNonNull(name);
    }

    public Symbol name() {
        return name;
    }

    void add(Rule rule) {
        if (!rule.name().equals(name))
            throw new IllegalArgumentException("Rule " + rule.name() + " added to group " + name);
        rules.add(rule);
    }

    public List<Rule> rules() {
        return Collections.unmodifiableList(rules);
    }

    public int size() {
        return rules.size();
    }

    @Override
    public String toString() {
        return "GenericRule[" + name + ", " + rules.size() + " clauses]";
    }
}
