package com.devstats.core.normalize;

import com.devstats.core.spi.ArrayToMapConverter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * [{name:a, value:1}, {name:b, value:2}] -> {a:{value:1}, b:{value:2}}.
 * El campo clave se quita del elemento; duplicados: gana el último.
 */
public class KeyFieldArrayToMapConverter implements ArrayToMapConverter {

    @Override
    public Optional<ObjectNode> convert(ArrayNode sequence, String keyName, String keyPrefix) {
        Objects.requireNonNull(keyName, "keyName");
        ObjectNode out = sequence.objectNode();
        String prefix = keyPrefix == null ? "" : keyPrefix;
        for (JsonNode item : sequence) {
            if (!(item instanceof ObjectNode obj)) return Optional.empty();
            JsonNode k = obj.get(keyName);
            if (k == null || !k.isValueNode() || k.isNull()) return Optional.empty();
            ObjectNode rest = obj.deepCopy();
            rest.remove(keyName);
            out.set(prefix + k.asText(), rest);
        }
        return Optional.of(out);
    }
}
