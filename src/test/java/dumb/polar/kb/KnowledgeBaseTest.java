package dumb.polar.kb;

import dumb.polar.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class KnowledgeBaseTest extends AbstractTest {

    private KnowledgeBase kb;

    @BeforeEach
    void setUp() {
        kb = new KnowledgeBase();
    }

    @Test
    void startsWithDefaultScopeOnly() {
        assertEquals(Set.of(sym("default")), kb.scopeNames());
        assertTrue(kb.scope(Path.DEFAULT).isPresent());
        assertTrue(kb.inlineQueries().isEmpty());
        assertTrue(kb.sources().isEmpty());
    }

    @Test
    void gensymNamingRule() {
        assertTrue(Pattern.matches("_\\d+", kb.gensym("_").name()));
        assertTrue(Pattern.matches("_foo_\\d+", kb.gensym("foo").name()));
        assertTrue(Pattern.matches("_foo_\\d+", kb.gensym("_foo").name()));
    }

    @Test
    void gensymNormalizesLeadingUnderscore() {
        var a = new KnowledgeBase().gensym("foo");
        var b = new KnowledgeBase().gensym("_foo");
        assertEquals(sym("_foo_1"), a);
        assertEquals(a, b);
    }

    @Test
    void gensymNeverRepeats() {
        var seen = new HashSet<Symbol>();
        for (var i = 0; i < 1000; i++) {
            assertTrue(seen.add(kb.gensym(i % 3 == 0 ? "_" : i % 3 == 1 ? "x" : "_x")));
        }
        assertEquals(1000, seen.size());
    }

    @Test
    void idsIncreaseAndFitInADouble() {
        var prev = kb.newId();
        for (var i = 0; i < 100; i++) {
            var next = kb.newId();
            assertTrue(next > prev);
            assertTrue(next <= Counter.MAX_ID);
            assertEquals(next, (long) (double) next);
            prev = next;
        }
    }

    @Test
    void idCounterHandleSharesSequence() {
        var handle = kb.idCounter();
        var a = kb.newId();
        var b = handle.next();
        var c = kb.newId();
        assertTrue(a < b && b < c);
    }

    @Test
    void gensymAndIdCountersAreIndependent() {
        kb.newId();
        kb.newId();
        assertEquals(sym("_1"), kb.gensym("_"));
    }

    @Test
    void constantsSurviveClearRules() {
        var v = str("v");
        kb.constant(sym("k"), v);
        kb.addRule(rule("f", Term.of(true), var("x")));
        assertTrue(kb.lookupRule(Path.of("f"), Path.DEFAULT).isPresent());

        kb.clearRules();

        assertTrue(kb.isConstant(sym("k")));
        assertEquals(v, kb.lookupConstant(Path.of("k"), Path.DEFAULT).orElseThrow());
        assertTrue(kb.lookupRule(Path.of("f"), Path.DEFAULT).isEmpty());
    }

    @Test
    void constantOverwrites() {
        kb.constant(sym("k"), num(1));
        kb.constant(sym("k"), num(2));
        assertEquals(num(2), kb.lookupConstant(Path.of("k"), Path.DEFAULT).orElseThrow());
        assertFalse(kb.isConstant(sym("other")));
    }

    @Test
    void rulesWithOneNameAccumulateInOrder() {
        var first = rule("allow", Term.of(true), str("alice"));
        var second = rule("allow", Term.of(true), str("bob"));
        kb.addRule(first);
        kb.addRule(second);

        var group = kb.lookupRule(Path.of("allow"), Path.DEFAULT).orElseThrow();
        assertEquals(sym("allow"), group.name());
        assertEquals(2, group.size());
        assertSame(first, group.rules().get(0));
        assertSame(second, group.rules().get(1));
        assertThrows(UnsupportedOperationException.class, () -> group.rules().add(first));
    }

    @Test
    void rulesAreGroupedPerScope() {
        kb.addScope("authz");
        kb.addRule(rule("allow", Term.of(true), str("alice")), Path.of("authz"));
        kb.addRule(rule("allow", Term.of(true), str("bob")));

        assertEquals(1, kb.lookupRule(Path.of("allow"), Path.of("authz")).orElseThrow().size());
        assertEquals(1, kb.lookupRule(Path.of("allow"), Path.DEFAULT).orElseThrow().size());
    }

    @Test
    void qualifiedLookupSeesEveryRegisteredScope() {
        kb.addScope("authz");
        kb.addScope("billing");
        var r = rule("allow", Term.of(true), var("x"));
        kb.addRule(r, Path.of("authz"));
        kb.constant(sym("limit"), num(10));

        // any base scope may reach into any other scope
        for (var base : List.of("default", "authz", "billing")) {
            var group = kb.lookupRule(Path.of("authz.allow"), Path.of(base));
            assertSame(r, group.orElseThrow().rules().get(0), base);
            assertEquals(num(10), kb.lookupConstant(Path.of("default.limit"), Path.of(base)).orElseThrow(), base);
        }
        // unqualified lookups stay within the base scope
        assertTrue(kb.lookupRule(Path.of("allow"), Path.of("billing")).isEmpty());
        assertTrue(kb.lookupConstant(Path.of("limit"), Path.of("authz")).isEmpty());
    }

    @Test
    void includedScopeIsAnyRegisteredScope() {
        var authz = kb.addScope("authz");
        var base = kb.scope(Path.DEFAULT).orElseThrow();
        assertSame(authz, kb.getIncludedScope(base, Path.of("authz")).orElseThrow());
        assertSame(base, kb.getIncludedScope(authz, Path.DEFAULT).orElseThrow());
        assertTrue(kb.getIncludedScope(base, Path.of("missing")).isEmpty());
    }

    @Test
    void missingScopesAreAbsentNotErrors() {
        kb.constant(sym("k"), num(1));
        assertTrue(kb.lookupConstant(Path.of("k"), Path.of("nowhere")).isEmpty());
        assertTrue(kb.lookupRule(Path.of("f"), Path.of("nowhere")).isEmpty());
        assertTrue(kb.lookupConstant(Path.of("nowhere.k"), Path.DEFAULT).isEmpty());
        assertTrue(kb.lookupRule(Path.of("nowhere.f"), Path.DEFAULT).isEmpty());
    }

    @Test
    void addRuleToUnregisteredScopeIsFatal() {
        var r = rule("f", Term.of(true));
        assertThrows(AssertionError.class, () -> kb.addRule(r, Path.of("nowhere")));
        assertTrue(kb.lookupRule(Path.of("f"), Path.of("nowhere")).isEmpty());
        assertTrue(kb.lookupRule(Path.of("f"), Path.DEFAULT).isEmpty());
    }

    @Test
    void addScopeIsIdempotent() {
        var a = kb.addScope("authz");
        kb.addRule(rule("f", Term.of(true)), Path.of("authz"));
        assertSame(a, kb.addScope("authz"));
        assertEquals(1, a.rules().size());
        assertEquals(Path.of("authz"), a.name());
    }

    @Test
    void dottedScopeNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> kb.addScope("a.b"));
        assertEquals(Set.of(sym("default")), kb.scopeNames());
        assertThrows(IllegalArgumentException.class,
                () -> KnowledgeBase.create(new KnowledgeBaseConfig(List.of("authz.admin"))));
    }

    @Test
    void clearRulesResetsSourcesAndInlineQueries() {
        var id = kb.addSource(new Sources.Source("policy.polar", "allow(_, _);"));
        kb.addInlineQuery(call("allow", str("a"), str("b")));
        kb.addScope("authz");
        kb.addRule(rule("g", Term.of(true)), Path.of("authz"));
        assertEquals("policy.polar", kb.getSource(id).orElseThrow().filename());
        assertEquals(1, kb.inlineQueries().size());

        kb.clearRules();

        assertTrue(kb.getSource(id).isEmpty());
        assertTrue(kb.inlineQueries().isEmpty());
        assertTrue(kb.lookupRule(Path.of("g"), Path.of("authz")).isEmpty());
        assertTrue(kb.scope(Path.of("authz")).isPresent());
    }

    @Test
    void sourceIdsComeFromIdCounter() {
        var before = kb.newId();
        var id = kb.addSource(new Sources.Source(null, "f(1);"));
        assertTrue(id > before);
        assertNull(kb.getSource(id).orElseThrow().filename());
    }

    @Test
    void createFromConfigRegistersScopes() {
        var configured = KnowledgeBase.create(new KnowledgeBaseConfig(List.of("authz", "billing")));
        assertEquals(Set.of(sym("default"), sym("authz"), sym("billing")), configured.scopeNames());
        configured.addRule(rule("f", Term.of(true)), Path.of("billing"));
    }
}
