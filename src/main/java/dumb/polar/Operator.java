package dumb.polar;

/** Tag of an {@link Operation}. */
public enum Operator {
    Debug("debug"),
    Print("print"),
    Cut("cut"),
    In("in"),
    Isa("matches"),
    New("new"),
    Dot("."),
    Not("not"),
    Mul("*"),
    Div("/"),
    Mod("mod"),
    Rem("rem"),
    Add("+"),
    Sub("-"),
    Eq("=="),
    Geq(">="),
    Leq("<="),
    Neq("!="),
    Gt(">"),
    Lt("<"),
    Unify("="),
    Or("or"),
    And("and"),
    ForAll("forall"),
    Assign(":=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    /** Surface spelling in rule source. */
    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        return switch (this) {
            case Eq, Geq, Leq, Neq, Gt, Lt -> true;
            default -> false;
        };
    }

    public boolean isArithmetic() {
        return switch (this) {
            case Mul, Div, Mod, Rem, Add, Sub -> true;
            default -> false;
        };
    }
}
