package dumb.polar;

/**
 * Where a {@link Term} came from. Rewrite passes carry it over unchanged.
 */
public sealed interface SourceInfo permits SourceInfo.Parser, SourceInfo.Temporary, SourceInfo.Host, SourceInfo.Test {

    SourceInfo TEMPORARY = new Temporary();
    SourceInfo HOST = new Host();
    SourceInfo TEST = new Test();

    static SourceInfo parser(long srcId, int left, int right) {
        return new Parser(srcId, left, right);
    }

    /** Span {@code [left, right)} of source {@code srcId} in the knowledge base's source registry. */
    record Parser(long srcId, int left, int right) implements SourceInfo {
        public Parser {
            if (left < 0 || right < left)
                throw new IllegalArgumentException("Invalid source span: [" + left + ", " + right + ")");
        }
    }

    /** Made up by a rewrite pass, e.g. a renamed variable. */
    record Temporary() implements SourceInfo {
    }

    /** Built by the embedding application. */
    record Host() implements SourceInfo {
    }

    record Test() implements SourceInfo {
    }
}
