package dumb.polar;

import static java.util.Objects.requireNonNull;

/** Class tag plus field patterns, e.g. {@code Person{name: "alice"}}. */
public record InstanceLiteral(Symbol tag, Dictionary fields) implements Value {
    public InstanceLiteral {
        requireNonNull(tag);
        requireNonNull(fields);
    }

    @Override
    public String toString() {
        return tag + fields.toString();
    }
}
