package com.devstats.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.regex.Pattern;

/**
 * Extrae el valor en un path {@code "a::b::c"}. Si falta algún segmento devuelve
 * {@link #MISSING_KEY}: muchas métricas no existen si el device no las tiene configuradas.
 * El centinela se compara por identidad; un string {@code "missing key"} que venga
 * del device es un valor presente.
 */
public class KeyPathResolver {
    public static final String SEPARATOR = "::";
    public static final TextNode MISSING_KEY = TextNode.valueOf("missing key");

    private static final Pattern SPLIT = Pattern.compile(Pattern.quote(SEPARATOR));

    public JsonNode resolve(JsonNode data, String path) {
        JsonNode cur = data;
        for (String segment : SPLIT.split(path, -1)) {
            if (cur instanceof ObjectNode obj && obj.has(segment)) cur = obj.get(segment);
            else cur = MISSING_KEY;
        }
        return cur;
    }

    public static boolean isMissing(JsonNode n) {
        return n == MISSING_KEY;
    }
}
