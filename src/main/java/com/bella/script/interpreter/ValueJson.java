package com.bella.script.interpreter;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** JSON view of values and frames, used for environment dumps. */
public final class ValueJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ValueJson() {}

    public static JsonNode toJson(Value v) {
        switch (v.getType()) {
            case NUMBER: {
                double d = v.asNumber();
                // JSON has no NaN/Infinity
                if (Double.isNaN(d) || Double.isInfinite(d)) return NODES.textNode(Double.toString(d));
                if (d == Math.rint(d) && Math.abs(d) < 1e15) return NODES.numberNode((long) d);
                return NODES.numberNode(d);
            }
            case BOOL:
                return NODES.booleanNode(v.asBool());
            case ARRAY: {
                ArrayNode a = NODES.arrayNode();
                for (Value item : v.asArray()) a.add(toJson(item));
                return a;
            }
            case FUNC:
                return NODES.textNode(v.asFunc().toString());
            default:
                throw new IllegalStateException("Unhandled value type: " + v.getType());
        }
    }

    public static ObjectNode toJson(Map<String, Value> bindings) {
        ObjectNode o = NODES.objectNode();
        for (Map.Entry<String, Value> e : bindings.entrySet()) {
            o.set(e.getKey(), toJson(e.getValue()));
        }
        return o;
    }
}
