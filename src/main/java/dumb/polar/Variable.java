package dumb.polar;

import static java.util.Objects.requireNonNull;

/** Named logic variable. */
public record Variable(Symbol name) implements Value {
    public Variable {
        requireNonNull(name);
    }

    public static Variable of(String name) {
        return new Variable(Symbol.of(name));
    }

    /** Variables made by gensym start with an underscore. */
    public boolean isTemporary() {
        return name.name().startsWith("_");
    }

    @Override
    public String toString() {
        return name.name();
    }
}
