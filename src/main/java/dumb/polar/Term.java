package dumb.polar;

import dumb.polar.fold.Folder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * AST node: a {@link Value} plus the provenance it was parsed or built with.
 * Immutable; rewriting produces a new term via {@link #withValue(Value)}.
 */
public final class Term {
    private final SourceInfo source;
    private final Value value;
    private volatile int hashCodeCache;
    private volatile boolean hashCodeCalculated = false;

    public Term(SourceInfo source, Value value) {
        this.source = requireNonNull(source);
        this.value = requireNonNull(value);
    }

    public static Term of(Value value) {
        return new Term(SourceInfo.HOST, value);
    }

    public static Term temporary(Value value) {
        return new Term(SourceInfo.TEMPORARY, value);
    }

    public static Term of(String s) {
        return of(Value.of(s));
    }

    public static Term of(long n) {
        return of(Value.of(n));
    }

    public static Term of(boolean b) {
        return of(Value.of(b));
    }

    public static Term var(String name) {
        return of(Variable.of(name));
    }

    public Value value() {
        return value;
    }

    public SourceInfo source() {
        return source;
    }

    /** Same provenance, different content. */
    public Term withValue(Value value) {
        return value == this.value ? this : new Term(source, value);
    }

    /** Every variable reachable from this term, in first-seen order. */
    public Set<Variable> variables() {
        var seen = new LinkedHashSet<Variable>();
        new Folder() {
            @Override
            public Variable foldVariable(Variable v) {
                seen.add(v);
                return v;
            }
        }.foldTerm(this);
        return Collections.unmodifiableSet(seen);
    }

    public boolean isGround() {
        return variables().isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Term that && this.hashCode() == that.hashCode()
                && value.equals(that.value) && source.equals(that.source));
    }

    @Override
    public int hashCode() {
        if (!hashCodeCalculated) {
            hashCodeCache = Objects.hash(source, value);
            hashCodeCalculated = true;
        }
        return hashCodeCache;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
