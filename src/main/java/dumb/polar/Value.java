package dumb.polar;

import static java.util.Objects.requireNonNull;

/**
 * Payload of a {@link Term}. Exactly one variant is active.
 *
 * <p>The number, variable, dictionary, instance literal, call, list and expression
 * variants are their own types; strings and booleans are wrapped in {@link Str} and {@link Bool}.</p>
 */
public sealed interface Value permits Numeric, Value.Str, Value.Bool, Variable, Dictionary, InstanceLiteral, Call, Lst, Operation {

    static Value of(String s) {
        return new Str(s);
    }

    static Value of(boolean b) {
        return b ? Bool.TRUE : Bool.FALSE;
    }

    static Value of(long n) {
        return new Numeric.Int(n);
    }

    static Value of(double n) {
        return new Numeric.Float(n);
    }

    record Str(String value) implements Value {
        public Str {
            requireNonNull(value);
        }

        @Override
        public String toString() {
            return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
    }

    record Bool(boolean value) implements Value {
        public static final Bool TRUE = new Bool(true), FALSE = new Bool(false);

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }
}
