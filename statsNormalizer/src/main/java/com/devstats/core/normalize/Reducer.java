package com.devstats.core.normalize;

import com.devstats.core.model.NormalizationOptions;
import com.devstats.core.spi.ArrayToMapConverter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reduce la estructura de stats del device a sus datos sustantivos:
 * <ul>
 *   <li>desenvuelve mapas de una sola clave "andamio" ({@link #SCAFFOLD_KEYS}), en cadena;</li>
 *   <li>aplana contenedores {@code entries}, simplificando las claves tipo URL;</li>
 *   <li>opcionalmente pivota secuencias a mapas ({@code convertArrayToMap}).</li>
 * </ul>
 * Idempotente: reducir un árbol ya reducido no lo cambia. No modifica la entrada.
 */
public class Reducer {
    private static final Logger LOG = LoggerFactory.getLogger(Reducer.class);

    public static final Set<String> SCAFFOLD_KEYS = Set.of("nestedStats", "value", "description", "color");
    public static final String ENTRIES = "entries";

    static final String HOST_PREFIX = "https://localhost/";
    // el más específico primero; se quita sólo uno
    static final List<String> PATH_PREFIXES = List.of("mgmt/tm/sys/", "mgmt/tm/");

    private final ArrayToMapConverter converter;
    private final int maxDepth;

    public Reducer(ArrayToMapConverter converter, int maxDepth) {
        this.converter = converter;
        this.maxDepth = maxDepth;
    }

    public JsonNode reduce(JsonNode node, NormalizationOptions.ArrayToMap convertArrayToMap) {
        return reduce(node, convertArrayToMap, 0);
    }

    private JsonNode reduce(JsonNode node, NormalizationOptions.ArrayToMap catm, int depth) {
        if (depth > maxDepth) throw NormalizationException.tooDeep(maxDepth);

        if (node instanceof ObjectNode obj) {
            // andamio: {"value": x} -> x
            if (obj.size() == 1) {
                String only = obj.fieldNames().next();
                if (SCAFFOLD_KEYS.contains(only)) return reduce(obj.get(only), catm, depth + 1);
            }
            // entries: las claves hijas se simplifican y el mapa resultante se reduce entero
            JsonNode entries = obj.get(ENTRIES);
            // una secuencia puede pivotar a mapa; se decide sobre su forma reducida
            if (entries instanceof ArrayNode) entries = reduce(entries, catm, depth + 1);
            if (entries instanceof ObjectNode entriesObj) {
                ObjectNode flat = obj.objectNode();
                for (Iterator<Map.Entry<String, JsonNode>> it = entriesObj.fields(); it.hasNext(); ) {
                    var en = it.next();
                    flat.set(simplifyEntryKey(en.getKey()), en.getValue());
                }
                return reduce(flat, catm, depth + 1);
            }
            ObjectNode out = obj.objectNode();
            for (Iterator<Map.Entry<String, JsonNode>> it = obj.fields(); it.hasNext(); ) {
                var en = it.next();
                JsonNode v = ENTRIES.equals(en.getKey()) ? entries : reduce(en.getValue(), catm, depth + 1);
                out.set(en.getKey(), v);
            }
            return out;
        }

        if (node instanceof ArrayNode arr) {
            // primero los elementos: el pivot se prueba sobre la secuencia ya reducida
            ArrayNode out = arr.arrayNode(arr.size());
            for (JsonNode item : arr) out.add(reduce(item, catm, depth + 1));
            if (catm != null && catm.keyName() != null && !out.isEmpty()) {
                Optional<ObjectNode> pivoted = converter.convert(out, catm.keyName(), catm.keyNamePrefix());
                if (pivoted.isPresent()) return reduce(pivoted.get(), catm, depth + 1);
                LOG.debug("Sequence of {} items has no '{}' key field on every element, keeping it as a sequence",
                        out.size(), catm.keyName());
            }
            return out;
        }

        // escalar
        return node;
    }

    /** https://localhost/mgmt/tm/sys/tmm-info/0.0/stats -> tmm-info/0.0/stats */
    static String simplifyEntryKey(String key) {
        String k = removeFirst(key, HOST_PREFIX);
        for (String prefix : PATH_PREFIXES) {
            if (k.contains(prefix)) return removeFirst(k, prefix);
        }
        return k;
    }

    private static String removeFirst(String s, String token) {
        int i = s.indexOf(token);
        return i < 0 ? s : s.substring(0, i) + s.substring(i + token.length());
    }
}
