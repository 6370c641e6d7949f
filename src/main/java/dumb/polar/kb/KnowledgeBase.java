package dumb.polar.kb;

import dumb.polar.Rule;
import dumb.polar.Symbol;
import dumb.polar.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;
import static java.util.Optional.ofNullable;

/**
 * Constants and rules of a loaded program, organized in named scopes, plus the ID and
 * gensym counters used while loading and querying it.
 *
 * <p>There is always a {@code default} scope; constants live there. Mutation
 * ({@link #addRule}, {@link #constant}, {@link #clearRules}) assumes a single writer;
 * rules handed out by lookups are immutable and may be shared freely.</p>
 */
public class KnowledgeBase {
    public static final String DEFAULT_SCOPE = "default";
    private static final Logger logger = LoggerFactory.getLogger(KnowledgeBase.class);
    private static final Symbol DEFAULT = Symbol.of(DEFAULT_SCOPE);

    private final Map<Symbol, Scope> scopes = new HashMap<>();
    private final Sources sources = new Sources();
    /** For symbols returned from gensym. */
    private final Counter gensymCounter = new Counter();
    /** For call IDs, instance IDs, source IDs. */
    private final Counter idCounter = new Counter();
    private final List<Term> inlineQueries = new ArrayList<>();

    public KnowledgeBase() {
        scopes.put(DEFAULT, new Scope(Path.DEFAULT));
    }

    public static KnowledgeBase create(KnowledgeBaseConfig config) {
        var kb = new KnowledgeBase();
        config.scopes().forEach(kb::addScope);
        return kb;
    }

    /**
     * Next monotonically increasing ID. Wraps around at 2^52 so that it can be
     * coerced to a double without loss.
     */
    public long newId() {
        return idCounter.next();
    }

    /** Handle over the same sequence as {@link #newId()}. */
    public Counter idCounter() {
        return idCounter.share();
    }

    /**
     * Fresh symbol: {@code _<n>} for the prefix {@code "_"}, {@code <prefix>_<n>} when the
     * prefix already starts with an underscore, {@code _<prefix>_<n>} otherwise.
     */
    public Symbol gensym(String prefix) {
        requireNonNull(prefix);
        var next = gensymCounter.next();
        if (prefix.equals("_")) return new Symbol("_" + next);
        else if (prefix.startsWith("_")) return new Symbol(prefix + "_" + next);
        else return new Symbol("_" + prefix + "_" + next);
    }

    /**
     * Registers a scope; a no-op if it exists. Scope names are single segments.
     *
     * @throws IllegalArgumentException for a dotted name
     */
    public Scope addScope(Path name) {
        if (name.segments().size() != 1)
            throw new IllegalArgumentException("Scope name must be a single segment: " + name);
        return scopes.computeIfAbsent(name.first(), n -> {
            logger.debug("Registered scope {}", n);
            return new Scope(Path.of(n));
        });
    }

    public Scope addScope(String name) {
        return addScope(Path.of(name));
    }

    public Optional<Scope> scope(Path name) {
        return ofNullable(scopes.get(name.first()));
    }

    public Set<Symbol> scopeNames() {
        return Collections.unmodifiableSet(scopes.keySet());
    }

    /** Defines a constant, in the default scope. Constants survive {@link #clearRules()}. */
    public void constant(Symbol name, Term value) {
        requireNonNull(value);
        var previous = scopes.computeIfAbsent(DEFAULT, n -> new Scope(Path.DEFAULT)).constants.put(requireNonNull(name), value);
        if (previous != null && !previous.equals(value))
            logger.debug("Constant {} redefined: {} -> {}", name, previous, value);
    }

    public boolean isConstant(Symbol symbol) {
        return lookupConstant(Path.of(symbol), Path.DEFAULT).isPresent();
    }

    /**
     * Constant named by {@code path}, seen from {@code scope}. Empty if the scope, the
     * qualifying scope or the name is unknown.
     */
    public Optional<Term> lookupConstant(Path path, Path scope) {
        return resolve(path, scope).flatMap(r -> ofNullable(r.scope.constants.get(r.name)));
    }

    /** Rule group named by {@code path}, seen from {@code scope}; resolved like {@link #lookupConstant}. */
    public Optional<GenericRule> lookupRule(Path path, Path scope) {
        return resolve(path, scope).flatMap(r -> ofNullable(r.scope.rules.get(r.name)));
    }

    private Optional<Member> resolve(Path path, Path scope) {
        var base = scopes.get(scope.first());
        if (base == null) return Optional.empty();
        var resolved = path.resolve();
        if (resolved instanceof Path.Qualified q)
            return getIncludedScope(base, Path.of(q.scope())).map(s -> new Member(s, q.name()));
        return Optional.of(new Member(base, resolved.name()));
    }

    /**
     * Scope {@code included} as visible from {@code base}. For now everything is
     * included in everything: any registered scope is returned.
     */
    public Optional<Scope> getIncludedScope(Scope base, Path included) {
        return ofNullable(scopes.get(included.first()));
    }

    /**
     * Appends {@code rule} as a new clause of its rule group in {@code scope}.
     *
     * @throws AssertionError if {@code scope} was never registered; rules may only be
     *                        added to scopes created during setup
     */
    public void addRule(Rule rule, Path scope) {
        requireNonNull(rule);
        var s = scopes.get(scope.first());
        if (s == null) {
            logger.error("Rule {} added to unregistered scope {}", rule.name(), scope);
            throw new AssertionError("Scope not registered: " + scope);
        }
        var group = s.rules.computeIfAbsent(rule.name(), GenericRule::new);
        group.add(rule);
        logger.debug("Added clause {} of {}/{} to scope {}", group.size(), rule.name(), rule.arity(), scope);
    }

    public void addRule(Rule rule) {
        addRule(rule, Path.DEFAULT);
    }

    /** Clears rules, sources and inline queries from every scope, leaving constants and counters in place. */
    public void clearRules() {
        var cleared = 0;
        for (var scope : scopes.values()) {
            cleared += scope.rules.size();
            scope.rules.clear();
        }
        logger.info("Cleared {} rule groups, {} sources, {} inline queries", cleared, sources.size(), inlineQueries.size());
        sources.clear();
        inlineQueries.clear();
    }

    /** Registers program text; the returned id goes into {@link dumb.polar.SourceInfo.Parser} spans. */
    public long addSource(Sources.Source source) {
        var id = newId();
        sources.add(id, source);
        return id;
    }

    public Optional<Sources.Source> getSource(long id) {
        return sources.get(id);
    }

    public Sources sources() {
        return sources;
    }

    /** Queues a query written inline in the program, run once loading completes. */
    public void addInlineQuery(Term query) {
        inlineQueries.add(requireNonNull(query));
    }

    public List<Term> inlineQueries() {
        return Collections.unmodifiableList(inlineQueries);
    }

    private record Member(Scope scope, Symbol name) {
    }
}
