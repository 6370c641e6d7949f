package dumb.polar.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.polar.*;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Shared Jackson mapper, and the JSON form of terms read by host bindings.
 *
 * <p>Values are externally tagged by variant, e.g.
 * {@code {"value": {"Call": {"name": "f", "args": [...], "kwargs": null}}}}.
 * Provenance is not encoded.</p>
 */
public class Json {

    public static final ObjectMapper the = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public static String str(Object obj) {
        try {
            Object tree = obj instanceof Term t ? node(t) : obj instanceof Rule r ? node(r) : obj;
            return the.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Error serializing object to JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static <T> T obj(String json, Class<T> valueType) throws JsonProcessingException {
        return the.readValue(json, valueType);
    }

    public static ObjectNode node() {
        return the.createObjectNode();
    }

    public static ObjectNode node(Term term) {
        return node().set("value", value(term.value()));
    }

    public static ObjectNode node(Rule rule) {
        var n = node();
        n.put("name", rule.name().name());
        var params = n.putArray("params");
        for (var p : rule.params()) {
            var pn = params.addObject();
            pn.set("parameter", node(p.parameter()));
            pn.set("specializer", p.specializer() == null ? null : node(p.specializer()));
        }
        n.set("body", node(rule.body()));
        n.put("required", rule.required());
        return n;
    }

    static ObjectNode value(Value v) {
        var n = node();
        if (v instanceof Numeric.Int i) n.putObject("Number").put("Integer", i.value());
        else if (v instanceof Numeric.Float f) n.putObject("Number").put("Float", f.value());
        else if (v instanceof Value.Str s) n.put("String", s.value());
        else if (v instanceof Value.Bool b) n.put("Boolean", b.value());
        else if (v instanceof Variable x) n.put("Variable", x.name().name());
        else if (v instanceof Dictionary d) n.set("Dictionary", dictionary(d));
        else if (v instanceof InstanceLiteral i) {
            var in = n.putObject("InstanceLiteral");
            in.put("tag", i.tag().name());
            in.set("fields", dictionary(i.fields()));
        } else if (v instanceof Call c) {
            var cn = n.putObject("Call");
            cn.put("name", c.name().name());
            cn.set("args", terms(c.args()));
            cn.set("kwargs", c.kwargs() == null ? null : fields(c.kwargs()));
        } else if (v instanceof Lst l) {
            var ln = n.putObject("List");
            ln.set("elements", terms(l.elements()));
            if (l.restVar() == null) ln.putNull("rest_var");
            else ln.put("rest_var", l.restVar().name().name());
        } else if (v instanceof Operation o) {
            var on = n.putObject("Expression");
            on.put("operator", o.operator().name());
            on.set("args", terms(o.args()));
        }
        return n;
    }

    private static ObjectNode dictionary(Dictionary d) {
        return node().set("fields", fields(d.fields()));
    }

    private static ObjectNode fields(Map<Symbol, Term> fields) {
        var n = node();
        fields.forEach((k, t) -> n.set(k.name(), node(t)));
        return n;
    }

    private static ArrayNode terms(List<Term> terms) {
        var a = the.createArrayNode();
        terms.forEach(t -> a.add(node(t)));
        return a;
    }
}
