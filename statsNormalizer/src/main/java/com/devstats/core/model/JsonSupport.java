package com.devstats.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;

public final class JsonSupport {
    private JsonSupport(){}
    public static final ObjectMapper MAPPER = new ObjectMapper();

    // catálogo y config
    public static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static final JsonNodeFactory NODES = MAPPER.getNodeFactory();

    public static JsonNode readTree(byte[] b){
        try { return MAPPER.readTree(b); }
        catch (IOException e){ throw new IllegalArgumentException("Invalid JSON payload", e); }
    }
    public static JsonNode readTree(String s){
        try { return MAPPER.readTree(s); }
        catch (JsonProcessingException e){ throw new IllegalArgumentException("Invalid JSON payload", e); }
    }
}
