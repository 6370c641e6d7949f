package dumb.polar.kb;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static java.util.Optional.ofNullable;

/** Program texts loaded into a knowledge base, by source id. Used to point diagnostics at rule source. */
public final class Sources {
    private final Map<Long, Source> sources = new HashMap<>();

    void add(long id, Source source) {
        sources.put(id, requireNonNull(source));
    }

    public Optional<Source> get(long id) {
        return ofNullable(sources.get(id));
    }

    public int size() {
        return sources.size();
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    void clear() {
        sources.clear();
    }

    public record Source(@Nullable String filename, String src) {
        public Source {
            requireNonNull(src);
        }
    }
}
