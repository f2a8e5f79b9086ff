package com.devstats.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationOptionsTest {

    @Test
    void bindsFromYaml() throws Exception {
        String yaml = String.join("\n",
                "key: \"a::b\"",
                "filterByKeys: [ cpu, mem ]",
                "renameKeysByPattern:",
                "  tmm: \"tmm_\\\\d+\"",
                "  cpu:",
                "    pattern: \"cpu(\\\\d+)\"",
                "    group: 1",
                "convertArrayToMap:",
                "  keyName: name",
                "  keyNamePrefix: \"if_\"",
                "runCustomFunction:",
                "  name: getAverage",
                "  args:",
                "    keyWithPrefix: tmm",
                "unknownOption: ignored");

        NormalizationOptions o = JsonSupport.YAML.readValue(yaml, NormalizationOptions.class);

        assertEquals("a::b", o.key());
        assertEquals(List.of("cpu", "mem"), o.filterByKeys());
        assertEquals(List.of("tmm", "cpu"), List.copyOf(o.renameKeysByPattern().keySet()));
        assertEquals(RenamePattern.of("tmm_\\d+", 0), o.renameKeysByPattern().get("tmm"));
        assertEquals(RenamePattern.of("cpu(\\d+)", 1), o.renameKeysByPattern().get("cpu"));
        assertEquals(new NormalizationOptions.ArrayToMap("name", "if_"), o.convertArrayToMap());
        assertEquals("getAverage", o.runCustomFunction().name());
        assertEquals("tmm", o.runCustomFunction().args().path("keyWithPrefix").asText());
    }

    @Test
    void bindsFromJson() throws Exception {
        NormalizationOptions o = JsonSupport.MAPPER.readValue(
                "{\"renameKeysByPattern\":{\"x\":{\"pattern\":\"x(.)\"}}}", NormalizationOptions.class);
        assertEquals(0, o.renameKeysByPattern().get("x").group());
        assertNull(o.key());
        assertNull(o.runCustomFunction());
    }

    @Test
    void groupBeyondPatternIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> RenamePattern.of("tmm_\\d+", 1));
        assertThrows(JsonMappingException.class, () -> JsonSupport.MAPPER.readValue(
                "{\"renameKeysByPattern\":{\"x\":{\"pattern\":\"x\",\"group\":2}}}", NormalizationOptions.class));
    }

    @Test
    void malformedPatternEntryIsRejected() {
        assertThrows(JsonProcessingException.class, () -> JsonSupport.MAPPER.readValue(
                "{\"renameKeysByPattern\":{\"x\":42}}", NormalizationOptions.class));
    }

    @Test
    void customFunctionNeedsName() {
        assertThrows(JsonProcessingException.class, () -> JsonSupport.MAPPER.readValue(
                "{\"runCustomFunction\":{\"args\":{}}}", NormalizationOptions.class));
    }

    @Test
    void customFunctionArgsCannotBeChangedFromOutside() {
        ObjectNode args = JsonSupport.NODES.objectNode().put("keyWithPrefix", "tmm");
        NormalizationOptions o = NormalizationOptions.builder().runCustomFunction("getAverage", args).build();

        args.put("keyWithPrefix", "other");
        o.runCustomFunction().args().put("extra", 1);

        assertEquals("tmm", o.runCustomFunction().args().path("keyWithPrefix").asText());
        assertFalse(o.runCustomFunction().args().has("extra"));
    }

    @Test
    void builderKeepsRenameOrder() {
        NormalizationOptions o = NormalizationOptions.builder()
                .renameKey("b", "b(.)", 1)
                .renameKey("a", "a(.)", 1)
                .build();
        assertEquals(List.of("b", "a"), List.copyOf(o.renameKeysByPattern().keySet()));
        assertNull(o.filterByKeys());
    }
}
