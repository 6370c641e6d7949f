package dumb.polar;

public sealed interface Numeric extends Value permits Numeric.Int, Numeric.Float {

    record Int(long value) implements Numeric {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Float(double value) implements Numeric {
        @Override
        public String toString() {
            return Double.toString(value);
        }
    }
}
