package com.devstats.plugins.functions;

import com.devstats.core.model.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Implementaciones de las funciones built-in. Todas reciben {@code args} con
 * {@code data} y los argumentos nombrados; entrada inválida -> IllegalArgumentException.
 */
final class StatsFunctions {
    private StatsFunctions(){}

    /** {a:{x:1,y:2}, b:{x:3}} -> {x:4, y:2} */
    static JsonNode getSum(ObjectNode args) {
        Map<String, BigDecimal> sums = new LinkedHashMap<>();
        accumulate(mapping(args), null, sums, new LinkedHashMap<>());
        ObjectNode out = JsonSupport.NODES.objectNode();
        sums.forEach((k, v) -> out.set(k, number(v)));
        return out;
    }

    /** Promedio por campo entre los hijos; {@code keyWithPrefix} limita qué hijos cuentan. */
    static JsonNode getAverage(ObjectNode args) {
        Map<String, BigDecimal> sums = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        accumulate(mapping(args), optionalText(args, "keyWithPrefix"), sums, counts);
        ObjectNode out = JsonSupport.NODES.objectNode();
        sums.forEach((k, v) -> out.set(k,
                number(v.divide(BigDecimal.valueOf(counts.get(k)), MathContext.DECIMAL64))));
        return out;
    }

    /** Primera clave del mapa, cortada antes de {@code splitOnValue} y con {@code keyPrefix} delante. */
    static JsonNode getFirstKey(ObjectNode args) {
        ObjectNode data = mapping(args);
        if (data.isEmpty()) throw new IllegalArgumentException("getFirstKey: data has no keys");
        String key = data.fieldNames().next();
        String split = optionalText(args, "splitOnValue");
        if (split != null && !split.isEmpty()) {
            int i = key.indexOf(split);
            if (i >= 0) key = key.substring(0, i);
        }
        String prefix = optionalText(args, "keyPrefix");
        return JsonSupport.NODES.textNode(prefix != null ? prefix + key : key);
    }

    /** round(partial / total * 100); con {@code inverse} devuelve 100 menos eso. */
    static JsonNode getPercentFromKeys(ObjectNode args) {
        ObjectNode data = mapping(args);
        double total = numberAt(data, requiredText(args, "totalKey"));
        double partial = numberAt(data, requiredText(args, "partialKey"));
        if (total == 0) throw new IllegalArgumentException("getPercentFromKeys: total is 0");
        long pct = Math.round(partial / total * 100);
        boolean inverse = args.path("inverse").asBoolean(false);
        return JsonSupport.NODES.numberNode(inverse ? 100 - pct : pct);
    }

    /** {a:{..}, b:{..}} -> [{..}, {..}] */
    static JsonNode convertMapToArray(ObjectNode args) {
        ObjectNode data = mapping(args);
        ArrayNode out = JsonSupport.NODES.arrayNode(data.size());
        data.elements().forEachRemaining(out::add);
        return out;
    }

    // ===== Helpers =====

    private static void accumulate(ObjectNode data, String keyWithPrefix,
                                   Map<String, BigDecimal> sums, Map<String, Integer> counts) {
        for (Iterator<Map.Entry<String, JsonNode>> it = data.fields(); it.hasNext(); ) {
            var child = it.next();
            if (keyWithPrefix != null && !child.getKey().startsWith(keyWithPrefix)) continue;
            if (!child.getValue().isObject()) continue;
            child.getValue().fields().forEachRemaining(f -> {
                if (!f.getValue().isNumber()) return;
                sums.merge(f.getKey(), f.getValue().decimalValue(), BigDecimal::add);
                counts.merge(f.getKey(), 1, Integer::sum);
            });
        }
    }

    // enteros se devuelven como long
    private static JsonNode number(BigDecimal v) {
        if (v.signum() == 0 || v.stripTrailingZeros().scale() <= 0) {
            try { return JsonSupport.NODES.numberNode(v.longValueExact()); }
            catch (ArithmeticException tooBig) { return JsonSupport.NODES.numberNode(v); }
        }
        return JsonSupport.NODES.numberNode(v.doubleValue());
    }

    private static ObjectNode mapping(ObjectNode args) {
        JsonNode data = args.get("data");
        if (data instanceof ObjectNode obj) return obj;
        throw new IllegalArgumentException("data must be an object, got "
                + (data == null ? "nothing" : data.getNodeType()));
    }

    private static double numberAt(ObjectNode data, String key) {
        JsonNode n = data.get(key);
        if (n == null || !n.isNumber()) throw new IllegalArgumentException("'" + key + "' is not a number in data");
        return n.asDouble();
    }

    private static String requiredText(ObjectNode args, String name) {
        String v = optionalText(args, name);
        if (v == null) throw new IllegalArgumentException("missing argument '" + name + "'");
        return v;
    }

    private static String optionalText(ObjectNode args, String name) {
        JsonNode n = args.get(name);
        return n == null || n.isNull() ? null : n.asText();
    }
}
