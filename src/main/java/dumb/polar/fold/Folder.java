package dumb.polar.fold;

import dumb.polar.*;

/**
 * AST to AST fold. Each method is a hook for one node kind; the default rewrites the
 * node's children through this same folder (see {@link Fold}) and reassembles it.
 *
 * <p>Override only the kinds a pass cares about. An overridden {@link #foldVariable}
 * sees every variable below calls, lists, dictionaries and operations, because the
 * defaults of those kinds recurse through this folder's own {@link #foldTerm}.
 * Overriding a composite hook without delegating to the generic routine
 * ({@code Folder.super.foldX} or {@code Fold.x(.., this)}) stops the traversal there.</p>
 *
 * <p>Additions to this interface must come with a public routine in {@link Fold} that
 * calls back only into the folder, never into other {@code Fold} routines.</p>
 */
public interface Folder {

    default Numeric foldNumber(Numeric n) {
        return Fold.number(n, this);
    }

    default String foldString(String s) {
        return Fold.string(s, this);
    }

    default boolean foldBoolean(boolean b) {
        return Fold.bool(b, this);
    }

    /** Class, key and rule names. */
    default Symbol foldSymbol(Symbol s) {
        return Fold.symbol(s, this);
    }

    default Variable foldVariable(Variable v) {
        return Fold.variable(v, this);
    }

    default Operator foldOperator(Operator o) {
        return Fold.operator(o, this);
    }

    default Rule foldRule(Rule r) {
        return Fold.rule(r, this);
    }

    default Term foldTerm(Term t) {
        return Fold.term(t, this);
    }

    default Value foldValue(Value v) {
        return Fold.value(v, this);
    }

    default InstanceLiteral foldInstanceLiteral(InstanceLiteral i) {
        return Fold.instanceLiteral(i, this);
    }

    default Dictionary foldDictionary(Dictionary d) {
        return Fold.dictionary(d, this);
    }

    default Call foldCall(Call c) {
        return Fold.call(c, this);
    }

    default Lst foldList(Lst l) {
        return Fold.list(l, this);
    }

    default Operation foldOperation(Operation o) {
        return Fold.operation(o, this);
    }

    default Parameter foldParam(Parameter p) {
        return Fold.param(p, this);
    }
}
