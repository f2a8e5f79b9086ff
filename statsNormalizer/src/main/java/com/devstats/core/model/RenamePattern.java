package com.devstats.core.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.io.IOException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Regex + grupo de captura para renombrar claves. En YAML/JSON acepta
 * un string ({@code "tmm_(\\d+)"}, grupo 0) o un objeto {@code {pattern, group}}.
 */
@JsonDeserialize(using = RenamePattern.Deserializer.class)
public final class RenamePattern {
    private final Pattern pattern;
    private final int group;      // 0 = match completo

    public RenamePattern(Pattern pattern, int group) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        if (group < 0) throw new IllegalArgumentException("group must be >= 0: " + group);
        int available = pattern.matcher("").groupCount();
        if (group > available)
            throw new IllegalArgumentException("group " + group + " not defined in pattern " + pattern.pattern());
        this.group = group;
    }

    public static RenamePattern of(String regex) { return new RenamePattern(Pattern.compile(regex), 0); }
    public static RenamePattern of(String regex, int group) { return new RenamePattern(Pattern.compile(regex), group); }

    public Pattern pattern() { return pattern; }
    public int group() { return group; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RenamePattern other)) return false;
        return group == other.group && pattern.pattern().equals(other.pattern.pattern());
    }
    @Override public int hashCode() { return Objects.hash(pattern.pattern(), group); }
    @Override public String toString() { return "RenamePattern[" + pattern.pattern() + ", group=" + group + "]"; }

    public static final class Deserializer extends JsonDeserializer<RenamePattern> {
        @Override
        public RenamePattern deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode n = p.getCodec().readTree(p);
            if (n.isTextual()) return of(n.asText());
            if (n.isObject() && n.path("pattern").isTextual()) {
                JsonNode g = n.get("group");
                int group = (g == null || g.isNull()) ? 0 : g.asInt();
                return of(n.get("pattern").asText(), group);
            }
            return ctxt.reportInputMismatch(RenamePattern.class,
                    "expected regex string or {pattern, group}, got %s", n.getNodeType());
        }
    }
}
