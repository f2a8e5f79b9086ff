package com.devstats.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

/**
 * Conserva sólo las claves que contienen alguno de los substrings dados
 * (case-sensitive, sin anclas) y recurre en lo conservado.
 * Las secuencias pasan sin filtrar.
 */
public class KeyFilter {
    private final int maxDepth;

    public KeyFilter(int maxDepth) { this.maxDepth = maxDepth; }

    public JsonNode filter(JsonNode data, Collection<String> keys) {
        return filter(data, keys, 0);
    }

    private JsonNode filter(JsonNode data, Collection<String> keys, int depth) {
        if (depth > maxDepth) throw NormalizationException.tooDeep(maxDepth);
        if (data instanceof ArrayNode arr) return arr.deepCopy();
        if (!(data instanceof ObjectNode obj)) return data;

        ObjectNode out = obj.objectNode();
        for (Iterator<Map.Entry<String, JsonNode>> it = obj.fields(); it.hasNext(); ) {
            var en = it.next();
            if (matchesAny(en.getKey(), keys)) out.set(en.getKey(), filter(en.getValue(), keys, depth + 1));
        }
        return out;
    }

    private static boolean matchesAny(String key, Collection<String> keys) {
        for (String k : keys) if (key.contains(k)) return true;
        return false;
    }
}
