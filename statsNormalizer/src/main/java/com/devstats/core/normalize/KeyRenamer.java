package com.devstats.core.normalize;

import com.devstats.core.model.RenamePattern;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Renombra claves por regex. Para cada clave se evalúan, en orden de inserción,
 * los patrones cuyo trigger aparece en la clave; si varios matchean gana el último.
 * La nueva clave es el grupo capturado (0 = match completo). Si dos claves
 * terminan con el mismo nombre, queda la última.
 */
public class KeyRenamer {
    private final int maxDepth;

    public KeyRenamer(int maxDepth) { this.maxDepth = maxDepth; }

    public JsonNode rename(JsonNode data, Map<String, RenamePattern> patterns) {
        return rename(data, patterns, 0);
    }

    private JsonNode rename(JsonNode data, Map<String, RenamePattern> patterns, int depth) {
        if (depth > maxDepth) throw NormalizationException.tooDeep(maxDepth);

        if (data instanceof ArrayNode arr) {
            ArrayNode out = arr.arrayNode(arr.size());
            for (JsonNode item : arr) out.add(rename(item, patterns, depth + 1));
            return out;
        }
        if (!(data instanceof ObjectNode obj)) return data;

        ObjectNode out = obj.objectNode();
        for (Iterator<Map.Entry<String, JsonNode>> it = obj.fields(); it.hasNext(); ) {
            var en = it.next();
            JsonNode value = rename(en.getValue(), patterns, depth + 1);
            out.set(renamedKey(en.getKey(), patterns), value);
        }
        return out;
    }

    static String renamedKey(String key, Map<String, RenamePattern> patterns) {
        String renamed = key;
        for (var p : patterns.entrySet()) {
            if (!key.contains(p.getKey())) continue;
            Matcher m = p.getValue().pattern().matcher(key);
            if (!m.find()) continue;
            String captured = m.group(p.getValue().group());
            // grupo opcional que no participó: no renombra
            if (captured != null) renamed = captured;
        }
        return renamed;
    }
}
