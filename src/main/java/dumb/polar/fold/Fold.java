package dumb.polar.fold;

import dumb.polar.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Generic rewrite for each node kind. Every routine hands children back to the folder
 * it was given, so overridden hooks apply at any depth.
 */
public enum Fold {
    ;

    public static Rule rule(Rule r, Folder fld) {
        var name = fld.foldSymbol(r.name());
        var params = new ArrayList<Parameter>(r.params().size());
        for (var p : r.params()) params.add(fld.foldParam(p));
        return new Rule(name, params, fld.foldTerm(r.body()), r.source(), r.required());
    }

    public static Term term(Term t, Folder fld) {
        return t.withValue(fld.foldValue(t.value()));
    }

    public static List<Term> termList(List<Term> terms, Folder fld) {
        var out = new ArrayList<Term>(terms.size());
        for (var t : terms) out.add(fld.foldTerm(t));
        return out;
    }

    /** Keys through {@link Folder#foldSymbol}, values through {@link Folder#foldTerm}; result is re-sorted by key. */
    public static SortedMap<Symbol, Term> fields(Map<Symbol, Term> fields, Folder fld) {
        var out = new TreeMap<Symbol, Term>();
        for (var e : fields.entrySet())
            out.put(fld.foldSymbol(e.getKey()), fld.foldTerm(e.getValue()));
        return out;
    }

    public static Value value(Value v, Folder fld) {
        if (v instanceof Numeric n) return fld.foldNumber(n);
        if (v instanceof Value.Str s) return new Value.Str(fld.foldString(s.value()));
        if (v instanceof Value.Bool b) return Value.of(fld.foldBoolean(b.value()));
        if (v instanceof Variable x) return fld.foldVariable(x);
        if (v instanceof Dictionary d) return fld.foldDictionary(d);
        if (v instanceof InstanceLiteral i) return fld.foldInstanceLiteral(i);
        if (v instanceof Call c) return fld.foldCall(c);
        if (v instanceof Lst l) return fld.foldList(l);
        if (v instanceof Operation o) return fld.foldOperation(o);
        throw new IllegalStateException("Unknown value variant: " + v.getClass().getName());
    }

    public static Numeric number(Numeric n, Folder fld) {
        return n;
    }

    public static String string(String s, Folder fld) {
        return s;
    }

    public static boolean bool(boolean b, Folder fld) {
        return b;
    }

    public static Symbol symbol(Symbol s, Folder fld) {
        return s;
    }

    public static Variable variable(Variable v, Folder fld) {
        return v;
    }

    public static Operator operator(Operator o, Folder fld) {
        return o;
    }

    public static InstanceLiteral instanceLiteral(InstanceLiteral i, Folder fld) {
        return new InstanceLiteral(fld.foldSymbol(i.tag()), fld.foldDictionary(i.fields()));
    }

    public static Dictionary dictionary(Dictionary d, Folder fld) {
        return new Dictionary(fields(d.fields(), fld));
    }

    public static Call call(Call c, Folder fld) {
        var kwargs = c.kwargs();
        return new Call(fld.foldSymbol(c.name()), termList(c.args(), fld),
                kwargs == null ? null : fields(kwargs, fld));
    }

    public static Lst list(Lst l, Folder fld) {
        var rest = l.restVar();
        return new Lst(termList(l.elements(), fld), rest == null ? null : fld.foldVariable(rest));
    }

    public static Operation operation(Operation o, Folder fld) {
        return new Operation(fld.foldOperator(o.operator()), termList(o.args(), fld));
    }

    public static Parameter param(Parameter p, Folder fld) {
        var specializer = p.specializer();
        return new Parameter(fld.foldTerm(p.parameter()), specializer == null ? null : fld.foldTerm(specializer));
    }
}
